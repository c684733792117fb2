package com.demo.loanmodel.export;

import com.demo.loanmodel.exception.ArtifactWriteException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Set;
import java.util.UUID;

/**
 * Replaces the artifact in one step: the JSON is rendered in memory, written next to the target
 * and moved over it. A failed run leaves the previous artifact untouched.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ArtifactWriter {

    private final ObjectMapper objectMapper;

    public Path write(ExportArtifact artifact, Path target) {
        byte[] payload;
        try {
            payload = objectMapper.writeValueAsBytes(artifact);
        } catch (JsonProcessingException e) {
            throw new ArtifactWriteException(target, e);
        }

        Path absolute = target.toAbsolutePath();
        Path tmp = null;
        try {
            Files.createDirectories(absolute.getParent());
            tmp = Files.createFile(absolute.resolveSibling(absolute.getFileName() + "." + UUID.randomUUID() + ".tmp"));
            Files.write(tmp, payload);
            keepPermissions(absolute, tmp);
            move(tmp, absolute);
        } catch (IOException e) {
            ArtifactWriteException failure = new ArtifactWriteException(target, e);
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException cleanup) {
                    failure.addSuppressed(cleanup);
                }
            }
            throw failure;
        }

        log.info("{} successfully written ({} bytes)", absolute.getFileName(), payload.length);
        return absolute;
    }

    /** A replaced artifact keeps its mode; a new one gets the umask default from createFile. */
    private static void keepPermissions(Path target, Path tmp) throws IOException {
        if (Files.exists(target) && Files.getFileStore(tmp).supportsFileAttributeView(PosixFileAttributeView.class)) {
            Set<PosixFilePermission> perms = Files.getPosixFilePermissions(target);
            Files.setPosixFilePermissions(tmp, perms);
        }
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
