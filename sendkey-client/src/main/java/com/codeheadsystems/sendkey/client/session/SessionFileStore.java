package com.codeheadsystems.sendkey.client.session;

import com.codeheadsystems.sendkey.client.model.Session;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists the {@link Session} between command-line invocations as JSON in a single file,
 * {@code ~/.sendkey} by default.
 * <p>
 * The file holds a live refresh token, so on POSIX file systems it is written readable and
 * writable by the owner only.
 */
public class SessionFileStore {

  private static final Logger log = LoggerFactory.getLogger(SessionFileStore.class);
  private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");

  private final Path path;
  private final ObjectMapper objectMapper;

  public SessionFileStore(final Path path, final ObjectMapper objectMapper) {
    this.path = path;
    this.objectMapper = objectMapper;
  }

  public static Path defaultPath() {
    return Paths.get(System.getProperty("user.home"), ".sendkey");
  }

  public Path path() {
    return path;
  }

  /**
   * Reads the saved session.
   *
   * @return the session, or empty if none has been saved
   * @throws UncheckedIOException if the file exists but cannot be read or parsed
   */
  public Optional<Session> load() {
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(Files.readString(path, StandardCharsets.UTF_8), Session.class));
    } catch (IOException e) {
      throw new UncheckedIOException("Could not read session file " + path, e);
    }
  }

  /**
   * Replaces the saved session. The new content is written to a sibling temp file and moved into
   * place, so a reader never sees a partial file.
   *
   * @param session the session to save
   */
  public void save(final Session session) {
    log.debug("save({})", session);
    try {
      Path parent = path.toAbsolutePath().getParent();
      Path temp = posix()
          ? Files.createTempFile(parent, ".sendkey", ".tmp", ownerOnly())
          : Files.createTempFile(parent, ".sendkey", ".tmp");
      Files.writeString(temp, objectMapper.writeValueAsString(session), StandardCharsets.UTF_8);
      Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
      if (posix()) {
        Files.setPosixFilePermissions(path, OWNER_ONLY);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Could not write session file " + path, e);
    }
  }

  /**
   * Deletes the saved session, if any.
   */
  public void clear() {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      throw new UncheckedIOException("Could not delete session file " + path, e);
    }
  }

  private static boolean posix() {
    return FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
  }

  private static FileAttribute<Set<PosixFilePermission>> ownerOnly() {
    return PosixFilePermissions.asFileAttribute(OWNER_ONLY);
  }
}
