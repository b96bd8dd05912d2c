package journal.destination;

import journal.Destination;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Destination that appends each rendered entry to a UTF-8 text file.
 *
 * <p>Entries are separated by a blank line. Parent directories are created on first
 * write. Writes are serialized per instance.
 */
public final class FileDestination implements Destination {

  private final String id;
  private final Path file;

  public FileDestination(Path file) {
    this("file:" + file.toAbsolutePath().normalize(), file);
  }

  public FileDestination(String id, Path file) {
    this.id = Objects.requireNonNull(id, "id");
    this.file = Objects.requireNonNull(file, "file");
  }

  @Override
  public String id() {
    return id;
  }

  public Path file() {
    return file;
  }

  @Override
  public synchronized void send(String content) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
        StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE)) {
      writer.write(content);
      writer.write(System.lineSeparator());
      writer.write(System.lineSeparator());
    }
  }

  @Override
  public String toString() {
    return "FileDestination{" + file + '}';
  }
}
