package io.fedlite.client.transport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Where a piece of PEM credential material comes from.
 * <p>
 * Sources are read every time a channel is opened, so a reconnect picks up
 * certificates rotated on disk.
 */
public interface CredentialSource {

    byte[] read() throws IOException;

    /** Human-readable origin for error messages. */
    String describe();

    static CredentialSource ofPath(Path path) {
        Objects.requireNonNull(path, "path");
        return new CredentialSource() {
            @Override
            public byte[] read() throws IOException {
                return Files.readAllBytes(path);
            }

            @Override
            public String describe() {
                return path.toString();
            }
        };
    }

    static CredentialSource ofBytes(byte[] bytes, String label) {
        Objects.requireNonNull(bytes, "bytes");
        byte[] copy = bytes.clone();
        return new CredentialSource() {
            @Override
            public byte[] read() {
                return copy.clone();
            }

            @Override
            public String describe() {
                return label;
            }
        };
    }
}
