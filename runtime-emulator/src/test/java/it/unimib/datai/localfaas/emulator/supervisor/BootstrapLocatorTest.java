package it.unimib.datai.localfaas.emulator.supervisor;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BootstrapLocatorTest {
    @TempDir
    Path dir;

    @Test
    void picksFirstExecutableCandidate() throws Exception {
        Path notExecutable = Files.writeString(dir.resolve("a"), "#!/bin/sh\n");
        Path executable = Files.writeString(dir.resolve("b"), "#!/bin/sh\n");
        Files.setPosixFilePermissions(executable, PosixFilePermissions.fromString("rwxr-xr-x"));
        Files.setPosixFilePermissions(notExecutable, PosixFilePermissions.fromString("rw-r--r--"));

        Path located = new BootstrapLocator(List.of(dir.resolve("missing"), notExecutable, executable)).locate();

        assertThat(located).isEqualTo(executable);
    }

    @Test
    void failsWithAllCandidatesListed() {
        List<Path> candidates = List.of(dir.resolve("x"), dir.resolve("y"));

        assertThatThrownBy(() -> new BootstrapLocator(candidates).locate())
                .isInstanceOf(BootstrapNotFoundException.class)
                .hasMessage("Couldn't find valid bootstrap(s): " + candidates);
    }

    @Test
    void directoriesAreNotBootstraps() {
        assertThatThrownBy(() -> new BootstrapLocator(List.of(dir)).locate())
                .isInstanceOf(BootstrapNotFoundException.class);
    }
}
