package fallible.test.file;

import fallible.api.FallibleException;

import java.nio.file.Path;

/** Structured error raised by {@link FileAccess#openFile(Path)} for a path that does not exist. */
public class FileNotFoundError extends FallibleException {

  private final Path path;

  public FileNotFoundError(Path path) {
    super("file not found: " + path);
    this.path = path;
  }

  public Path getPath() {
    return path;
  }

  @Override
  public String describe() {
    return "Looked for " + path.getFileName() + ", but nothing is there";
  }
}
