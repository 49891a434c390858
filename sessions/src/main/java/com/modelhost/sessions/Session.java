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

import java.io.File;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.modelhost.core.JsonUtils;
import com.modelhost.core.ModelHostException;

/**
 * Session is a single conversation's key/value store. Every value lives in its
 * own file under the session directory, named after the sanitized key and
 * holding the value's JSON encoding. The expiration instant is persisted next
 * to the values so that sessions survive a process restart.
 *
 * <p>
 * Sessions are created, looked up and destroyed by {@link SessionManager};
 * request handlers only read and write values:
 *
 * <pre>{@code
 * Session session = SessionInterceptor.currentSession(context);
 * int count = session.get("count", Integer.class, 0);
 * session.put("count", count + 1);
 * }</pre>
 *
 * <p>
 * {@code put} and {@code get} take no lock. Writes to different keys never
 * conflict; concurrent writes to the same key are last-writer-wins.
 */
public class Session {

  private static final Logger logger = LoggerFactory.getLogger(Session.class);

  /** Name of the file holding the persisted expiration, in epoch seconds. */
  public static final String EXPIRATION_FILE = ".expiration_ts";

  private static final char KEY_SEPARATOR_REPLACEMENT = '-';

  private final String id;
  private final Path filesPath;
  private final Instant expiration;

  /**
   * Creates a Session handle. The directory is not touched.
   *
   * @param id
   *            the session id
   * @param storageRoot
   *            the directory holding all session directories
   * @param expiration
   *            the expiry instant
   */
  Session(String id, Path storageRoot, Instant expiration) {
    this.id = id;
    this.filesPath = storageRoot.resolve(id);
    this.expiration = expiration;
  }

  /**
   * Recreates a Session from a directory written by a previous process.
   *
   * @param id
   *            the session id, which is also the directory name
   * @param storageRoot
   *            the directory holding all session directories
   * @return the session
   * @throws IOException
   *             if the expiration marker is missing or unreadable
   */
  static Session load(String id, Path storageRoot) throws IOException {
    Path marker = storageRoot.resolve(id).resolve(EXPIRATION_FILE);
    JsonNode node = JsonUtils.getObjectMapper().readTree(Files.readAllBytes(marker));
    if (node == null || !node.isNumber()) {
      throw new IOException("expiration marker is not a number: " + marker);
    }
    return new Session(id, storageRoot, fromEpochSeconds(node.asDouble()));
  }

  /**
   * Creates the session directory and persists the expiration marker.
   *
   * @throws ModelHostException
   *             if the directory or marker cannot be written
   */
  void initialize() {
    try {
      Files.createDirectory(filesPath);
      Files.writeString(filesPath.resolve(EXPIRATION_FILE), JsonUtils.toJson(toEpochSeconds(expiration)));
    } catch (IOException e) {
      throw new ModelHostException("Failed to create session directory " + filesPath, e);
    }
  }

  /**
   * Gets the session ID.
   *
   * @return the unique session identifier
   */
  public String getId() {
    return id;
  }

  /**
   * Gets the directory that holds this session's values.
   *
   * @return the session directory
   */
  public Path getFilesPath() {
    return filesPath;
  }

  /**
   * Gets the instant after which the session is no longer usable.
   *
   * @return the expiration instant
   */
  public Instant getExpiration() {
    return expiration;
  }

  /**
   * Returns true once {@code now} has reached the expiration instant.
   *
   * @param now
   *            the current instant
   * @return true if expired
   */
  public boolean isExpired(Instant now) {
    return !expiration.isAfter(now);
  }

  /**
   * Stores a value, overwriting any previous value for the key.
   *
   * @param key
   *            the key
   * @param value
   *            any value Jackson can serialize, including a {@link JsonNode}
   * @throws SessionException
   *             if the key is unsafe
   * @throws ModelHostException
   *             if the value cannot be serialized or written
   */
  public void put(String key, Object value) {
    Path path = resolvePath(key);
    String json = JsonUtils.toJson(value);
    try {
      Files.writeString(path, json);
    } catch (IOException e) {
      throw new ModelHostException("Failed to write session value '" + key + "' for session " + id, e);
    }
    logger.debug("Stored key {} in session {}", key, id);
  }

  /**
   * Reads a value.
   *
   * @param key
   *            the key
   * @return the stored JSON value, or null if the key was never written
   */
  public JsonNode get(String key) {
    return get(key, (JsonNode) null);
  }

  /**
   * Reads a value, falling back to a default.
   *
   * @param key
   *            the key
   * @param defaultValue
   *            returned when the key was never written
   * @return the stored JSON value or the default
   * @throws SessionException
   *             if the key is unsafe
   * @throws ModelHostException
   *             if the file exists but cannot be read or decoded
   */
  public JsonNode get(String key, JsonNode defaultValue) {
    Path path = resolvePath(key);
    byte[] content;
    try {
      content = Files.readAllBytes(path);
    } catch (NoSuchFileException e) {
      return defaultValue;
    } catch (IOException e) {
      throw new ModelHostException("Failed to read session value '" + key + "' for session " + id, e);
    }
    try {
      return JsonUtils.getObjectMapper().readTree(content);
    } catch (IOException e) {
      throw new ModelHostException("Failed to decode session value '" + key + "' for session " + id, e);
    }
  }

  /**
   * Reads a value and converts it to the given type.
   *
   * @param key
   *            the key
   * @param type
   *            the target type
   * @param defaultValue
   *            returned when the key was never written
   * @param <T>
   *            the value type
   * @return the converted value or the default
   */
  public <T> T get(String key, Class<T> type, T defaultValue) {
    JsonNode node = get(key, (JsonNode) null);
    if (node == null) {
      return defaultValue;
    }
    return JsonUtils.fromJsonNode(node, type);
  }

  /**
   * Deletes the session directory and everything in it.
   *
   * @return true once the directory is gone
   * @throws IllegalStateException
   *             if the directory no longer exists
   * @throws ModelHostException
   *             if deletion fails
   */
  boolean remove() {
    if (!Files.isDirectory(filesPath)) {
      throw new IllegalStateException("session directory does not exist: " + filesPath);
    }
    try {
      Files.walkFileTree(filesPath, new SimpleFileVisitor<Path>() {
        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
          Files.delete(file);
          return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
          if (exc != null) {
            throw exc;
          }
          Files.delete(dir);
          return FileVisitResult.CONTINUE;
        }
      });
    } catch (IOException e) {
      throw new ModelHostException("Failed to delete session directory " + filesPath, e);
    }
    return true;
  }

  /**
   * Maps a key to its file. This is the only way a key reaches the filesystem.
   *
   * <p>
   * Keys containing {@code ..} anywhere and absolute paths are rejected. Path
   * separators are replaced with {@code -}, so the result is always a direct
   * child of the session directory.
   *
   * @param key
   *            the key
   * @return the file for the key
   * @throws SessionException
   *             with reason {@code INVALID_ARGUMENT} if the key is unsafe
   */
  Path resolvePath(String key) {
    if (key == null || key.isEmpty()) {
      throw SessionException.invalidArgument("invalid key: empty key not allowed");
    }
    if (key.contains("..")) {
      throw SessionException.invalidArgument("invalid key: '..' not allowed in " + key);
    }
    Path keyPath;
    try {
      keyPath = Paths.get(key);
    } catch (InvalidPathException e) {
      throw new SessionException(SessionException.Reason.INVALID_ARGUMENT, "invalid key: " + e.getReason(), e, key);
    }
    if (key.startsWith("/") || key.startsWith("\\") || keyPath.isAbsolute()) {
      throw SessionException.invalidArgument("invalid key: absolute paths not allowed: " + key);
    }
    String fileName = key.replace('/', KEY_SEPARATOR_REPLACEMENT).replace('\\', KEY_SEPARATOR_REPLACEMENT)
        .replace(File.separatorChar, KEY_SEPARATOR_REPLACEMENT);
    if (fileName.equals(".") || fileName.equals(EXPIRATION_FILE)) {
      throw SessionException.invalidArgument("invalid key: reserved name " + key);
    }
    Path resolved = filesPath.resolve(fileName);
    if (!filesPath.equals(resolved.getParent())) {
      throw SessionException.invalidArgument("invalid key: resolves outside the session: " + key);
    }
    return resolved;
  }

  static double toEpochSeconds(Instant instant) {
    return instant.toEpochMilli() / 1000.0;
  }

  static Instant fromEpochSeconds(double seconds) {
    return Instant.ofEpochMilli(Math.round(seconds * 1000.0));
  }

  @Override
  public String toString() {
    return "Session{id=" + id + ", expiration=" + expiration + "}";
  }
}
