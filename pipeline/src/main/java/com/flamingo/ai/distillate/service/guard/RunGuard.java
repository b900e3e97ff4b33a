package com.flamingo.ai.distillate.service.guard;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.LongPredicate;
import lombok.extern.slf4j.Slf4j;

/**
 * Single-instance guard backed by a token file holding the owner's PID.
 *
 * <p>The token is published atomically by hard-linking a fully written temp file, so it never
 * exists without its PID. A token naming a dead process, the caller itself, or holding unreadable
 * content is stale: it is removed and creation is retried exactly once.
 */
@Slf4j
public class RunGuard {

  private final Path tokenFile;
  private final long ownPid;
  private final LongPredicate processAlive;

  public RunGuard(Path tokenFile) {
    this(
        tokenFile,
        ProcessHandle.current().pid(),
        pid -> ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false));
  }

  public RunGuard(Path tokenFile, long ownPid, LongPredicate processAlive) {
    this.tokenFile = tokenFile;
    this.ownPid = ownPid;
    this.processAlive = processAlive;
  }

  /**
   * Tries to take the guard.
   *
   * @return the lease, or empty when another live process holds the guard
   * @throws UncheckedIOException if the token file cannot be written or removed
   */
  public Optional<Lease> tryAcquire() {
    if (create()) {
      return Optional.of(new Lease());
    }

    Optional<Long> holder = readHolder();
    if (holder.isPresent() && holder.get() != ownPid && processAlive.test(holder.get())) {
      log.info("Guard {} held by live process {}", tokenFile, holder.get());
      return Optional.empty();
    }

    log.warn(
        "Removing stale guard {} (holder {})",
        tokenFile,
        holder.map(String::valueOf).orElse("unreadable"));
    try {
      Files.deleteIfExists(tokenFile);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot remove stale guard " + tokenFile, e);
    }

    if (create()) {
      return Optional.of(new Lease());
    }
    log.info("Guard {} taken by another process during stale-token recovery", tokenFile);
    return Optional.empty();
  }

  /** Publishes the token with its PID already written: a linked temp file, never a bare create. */
  private boolean create() {
    Path parent = tokenFile.toAbsolutePath().getParent();
    Path staged = null;
    try {
      Files.createDirectories(parent);
      staged = Files.createTempFile(parent, tokenFile.getFileName().toString(), ".tmp");
      Files.writeString(staged, Long.toString(ownPid), StandardCharsets.UTF_8);
      Files.createLink(tokenFile, staged);
      return true;
    } catch (FileAlreadyExistsException e) {
      return false;
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot create guard " + tokenFile, e);
    } finally {
      if (staged != null) {
        discardStaged(staged);
      }
    }
  }

  private void discardStaged(Path staged) {
    try {
      Files.deleteIfExists(staged);
    } catch (IOException e) {
      log.warn("Cannot remove staged guard {}: {}", staged, e.getMessage());
    }
  }

  private Optional<Long> readHolder() {
    try {
      String content = Files.readString(tokenFile, StandardCharsets.UTF_8).strip();
      return Optional.of(Long.parseLong(content));
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException | NumberFormatException e) {
      log.debug("Unreadable guard {}: {}", tokenFile, e.getMessage());
      return Optional.empty();
    }
  }

  /** Held guard; closing it removes the token. */
  public final class Lease implements AutoCloseable {

    private boolean released;

    private Lease() {}

    @Override
    public void close() {
      if (released) {
        return;
      }
      released = true;
      try {
        Files.deleteIfExists(tokenFile);
      } catch (IOException e) {
        log.error("Failed to release guard {}: {}", tokenFile, e.getMessage());
      }
    }
  }
}
