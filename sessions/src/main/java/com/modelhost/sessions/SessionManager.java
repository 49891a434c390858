/*
 * Copyright 2025 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package com.modelhost.sessions;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SessionManager is the registry of live sessions for one process. It picks
 * the storage root, creates sessions, looks them up, closes them and sweeps
 * the expired ones.
 *
 * <p>
 * A single monitor guards the registry. A session's directory and its registry
 * entry are always removed together while the monitor is held, so a
 * concurrent lookup never sees one without the other. Expiration is lazy: an
 * expired session is removed when it is looked up or when the next session is
 * created, never by a background thread.
 *
 * <p>
 * Example usage:
 *
 * <pre>{@code
 * SessionManager manager = new SessionManager(
 * 		SessionManagerOptions.builder().expiration(Duration.ofMinutes(10)).build());
 *
 * Session session = manager.createSession();
 * session.put("history", List.of("hello"));
 *
 * manager.getSession(session.getId()).get("history");
 * manager.closeSession(session.getId());
 * }</pre>
 */
public class SessionManager {

  private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

  /** Name of the directory created under the fast mount or temp directory. */
  public static final String SESSIONS_DIR_NAME = "sagemaker_sessions";

  /**
   * Session id clients send before they have a session. Looking it up is not an
   * error.
   */
  public static final String NEW_SESSION_SENTINEL = SessionRequestType.NEW_SESSION.name();

  private final Path storageRoot;
  private final Duration expiration;
  private final Clock clock;
  private final Map<String, Session> sessions = new HashMap<>();
  private final Object lock = new Object();

  /**
   * Creates a SessionManager from the process environment.
   */
  public SessionManager() {
    this(SessionManagerOptions.builder().build());
  }

  /**
   * Creates a SessionManager.
   *
   * @param options
   *            the session options; the enabled flag is ignored here
   * @throws SessionException
   *             with reason {@code CONFIGURATION} if the TTL is not positive,
   *             overflows the clock, or no writable storage location exists
   */
  public SessionManager(SessionManagerOptions options) {
    if (options.getExpiration() == null || options.getExpiration().isNegative()
        || options.getExpiration().isZero()) {
      throw SessionException.configuration("session expiration must be positive, got " + options.getExpiration());
    }
    this.expiration = options.getExpiration();
    this.clock = options.getClock();
    try {
      clock.instant().plus(expiration).toEpochMilli();
    } catch (ArithmeticException | DateTimeException e) {
      throw new SessionException(SessionException.Reason.CONFIGURATION,
          "session expiration is too large: " + expiration.getSeconds() + "s", e, expiration.toString());
    }
    this.storageRoot = selectStorageRoot(options);
    loadExistingSessions();
    logger.info("Session manager using {} with expiration {}s ({} existing sessions)", storageRoot,
        expiration.getSeconds(), sessions.size());
  }

  /**
   * Creates a SessionManager if the options enable stateful sessions.
   *
   * @param options
   *            the session options
   * @return the manager, or null when sessions are disabled
   */
  public static SessionManager fromOptions(SessionManagerOptions options) {
    if (!options.isEnabled()) {
      logger.info("Stateful sessions are disabled");
      return null;
    }
    return new SessionManager(options);
  }

  /**
   * Gets the directory that holds every session directory.
   *
   * @return the storage root
   */
  public Path getStorageRoot() {
    return storageRoot;
  }

  /**
   * Gets the TTL applied to new sessions.
   *
   * @return the expiration
   */
  public Duration getExpiration() {
    return expiration;
  }

  /**
   * Returns the ids of all registered sessions, including expired ones that
   * have not been swept yet.
   *
   * @return a snapshot of the registered ids
   */
  public Set<String> getSessionIds() {
    synchronized (lock) {
      return new LinkedHashSet<>(sessions.keySet());
    }
  }

  /**
   * Returns the number of registered sessions.
   *
   * @return the session count
   */
  public int getSessionCount() {
    synchronized (lock) {
      return sessions.size();
    }
  }

  /**
   * Creates a new session. Expired sessions are swept first.
   *
   * @return the new session, with its directory and expiration marker written
   */
  public Session createSession() {
    synchronized (lock) {
      cleanExpiredSessions();
      String sessionId = UUID.randomUUID().toString();
      while (sessions.containsKey(sessionId) || Files.exists(storageRoot.resolve(sessionId))) {
        sessionId = UUID.randomUUID().toString();
      }
      Instant expiresAt = clock.instant().plus(expiration).truncatedTo(ChronoUnit.MILLIS);
      Session session = new Session(sessionId, storageRoot, expiresAt);
      session.initialize();
      sessions.put(sessionId, session);
      logger.info("Created session {} expiring at {}", sessionId, expiresAt);
      return session;
    }
  }

  /**
   * Looks up a live session.
   *
   * @param sessionId
   *            the session id
   * @return the session; null if the id is null, empty or the
   *         {@code NEW_SESSION} sentinel, or if the session had expired (in
   *         which case it is removed)
   * @throws SessionException
   *             with reason {@code NOT_FOUND} if the id is not registered
   */
  public Session getSession(String sessionId) {
    if (sessionId == null || sessionId.isEmpty() || NEW_SESSION_SENTINEL.equals(sessionId)) {
      return null;
    }
    synchronized (lock) {
      Session session = sessions.get(sessionId);
      if (session == null) {
        throw SessionException.notFound(sessionId);
      }
      if (session.isExpired(clock.instant())) {
        logger.info("Session {} expired at {}", sessionId, session.getExpiration());
        removeExpiredSession(session);
        return null;
      }
      return session;
    }
  }

  /**
   * Closes a session, deleting its directory.
   *
   * @param sessionId
   *            the session id
   * @throws SessionException
   *             with reason {@code INVALID_ARGUMENT} if the id is null or empty,
   *             or {@code NOT_FOUND} if it is not registered
   */
  public void closeSession(String sessionId) {
    if (sessionId == null || sessionId.isEmpty()) {
      throw SessionException.invalidArgument("invalid session_id: " + sessionId);
    }
    synchronized (lock) {
      Session session = sessions.get(sessionId);
      if (session == null) {
        throw SessionException.notFound(sessionId);
      }
      removeSession(session);
    }
    logger.info("Closed session {}", sessionId);
  }

  /**
   * Removes every session whose expiration has been reached.
   *
   * @return the number of sessions removed
   */
  public int cleanExpiredSessions() {
    synchronized (lock) {
      Instant now = clock.instant();
      List<Session> expired = new ArrayList<>();
      for (Session session : sessions.values()) {
        if (session.isExpired(now)) {
          expired.add(session);
        }
      }
      for (Session session : expired) {
        removeExpiredSession(session);
      }
      if (!expired.isEmpty()) {
        logger.info("Removed {} expired sessions", expired.size());
      }
      return expired.size();
    }
  }

  /**
   * Registers a session directly. Used when restoring sessions from disk.
   */
  void register(Session session) {
    synchronized (lock) {
      sessions.put(session.getId(), session);
    }
  }

  // Caller holds the lock.
  private void removeSession(Session session) {
    try {
      session.remove();
    } finally {
      sessions.remove(session.getId());
    }
  }

  // Caller holds the lock. A directory deleted from outside only drops the entry.
  private void removeExpiredSession(Session session) {
    try {
      removeSession(session);
    } catch (IllegalStateException e) {
      logger.warn("Expired session {} had no directory left: {}", session.getId(), e.getMessage());
    }
  }

  private void loadExistingSessions() {
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(storageRoot, Files::isDirectory)) {
      for (Path entry : entries) {
        String sessionId = entry.getFileName().toString();
        try {
          register(Session.load(sessionId, storageRoot));
        } catch (IOException e) {
          logger.warn("Skipping {}: cannot read expiration marker ({})", entry, e.getMessage());
        }
      }
    } catch (IOException e) {
      throw new SessionException(SessionException.Reason.CONFIGURATION,
          "Failed to scan session storage " + storageRoot, e, storageRoot.toString());
    }
  }

  static Path selectStorageRoot(SessionManagerOptions options) {
    List<Path> candidates = new ArrayList<>();
    addCandidate(candidates, options.getStoragePath(), null);
    String fastRoot = options.getFastStorageRoot();
    if (fastRoot != null && Files.isDirectory(Paths.get(fastRoot)) && Files.isWritable(Paths.get(fastRoot))) {
      addCandidate(candidates, fastRoot, SESSIONS_DIR_NAME);
    }
    addCandidate(candidates, options.getTempRoot(), SESSIONS_DIR_NAME);

    for (Path candidate : candidates) {
      try {
        Files.createDirectories(candidate);
        if (Files.isWritable(candidate)) {
          return candidate;
        }
        logger.warn("Session storage candidate {} is not writable", candidate);
      } catch (IOException | SecurityException e) {
        logger.warn("Session storage candidate {} is unusable: {}", candidate, e.toString());
      }
    }
    throw new SessionException(SessionException.Reason.CONFIGURATION,
        "No writable session storage location among " + candidates, null, candidates.toString());
  }

  private static void addCandidate(List<Path> candidates, String root, String child) {
    if (root == null || root.isEmpty()) {
      return;
    }
    try {
      Path path = Paths.get(root);
      candidates.add(child != null ? path.resolve(child) : path);
    } catch (InvalidPathException e) {
      logger.warn("Ignoring invalid session storage path '{}': {}", root, e.getReason());
    }
  }
}
