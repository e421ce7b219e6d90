package org.shellsafe.compiler.validation;

import org.shellsafe.compiler.api.CompilerErrorCode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Contains unit tests for the {@link DeterminismCheck}.
 */
public class DeterminismCheckTest {

    /**
     * Verifies the digest against the well-known SHA-256 test vector.
     */
    @Test
    @Tag("unit")
    void testDigest() {
        // Act & Assert
        assertThat(DeterminismCheck.digest("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        assertThat(DeterminismCheck.digest("")).hasSize(64);
    }

    /**
     * Verifies that identical outputs pass and a single differing byte is reported with both digests.
     */
    @Test
    @Tag("unit")
    void testVerify() {
        // Act
        ValidationException e = catchThrowableOfType(
                () -> DeterminismCheck.verify("echo a\n", "echo b\n"), ValidationException.class);

        // Assert
        assertThatCode(() -> DeterminismCheck.verify("echo a\n", "echo a\n")).doesNotThrowAnyException();
        assertThat(e).isNotNull();
        assertThat(e.diagnostic().code()).isEqualTo(CompilerErrorCode.NON_DETERMINISTIC_OUTPUT);
        assertThat(e).hasMessageContaining(DeterminismCheck.digest("echo a\n"))
                .hasMessageContaining(DeterminismCheck.digest("echo b\n"));
    }
}
