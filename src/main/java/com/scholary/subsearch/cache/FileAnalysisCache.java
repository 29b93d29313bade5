package com.scholary.subsearch.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Analysis cache backed by gzip-compressed JSON files named by the SHA-1 of the key.
 *
 * <p>Layout: {@code <dir>/<sha1-hex>.json.gz}. Each write goes to a temporary file first and is
 * moved over the entry, so concurrent writers from different processes may duplicate work but
 * never leave a half-written entry.
 *
 * <p>Decoded entries are also held in a bounded Caffeine cache so repeated lookups within one
 * process skip the disk. There is no locking beyond that.
 */
public class FileAnalysisCache implements AnalysisCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileAnalysisCache.class);

  private static final String ENTRY_SUFFIX = ".json.gz";

  private final Path directory;
  private final ObjectMapper canonicalMapper;
  private final Cache<String, JsonNode> memory;

  private FileAnalysisCache(Path directory, ObjectMapper objectMapper, long memoryMaxSize) {
    this.directory = directory;
    this.canonicalMapper = canonical(objectMapper);
    this.memory = Caffeine.newBuilder().maximumSize(memoryMaxSize).build();
  }

  /**
   * Open (creating if needed) a cache directory.
   *
   * @param directory the cache directory
   * @param objectMapper mapper used to encode values
   * @param memoryMaxSize number of decoded entries kept in memory
   * @return the cache
   * @throws CacheException if the directory cannot be created
   */
  public static FileAnalysisCache open(
      Path directory, ObjectMapper objectMapper, long memoryMaxSize) {
    Path dir = directory.toAbsolutePath().normalize();
    try {
      if (!Files.isDirectory(dir)) {
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
          Files.createDirectories(
              dir,
              PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rwx------")));
        } else {
          Files.createDirectories(dir);
        }
      }
    } catch (IOException e) {
      throw new CacheException("Failed to create cache directory: " + dir, e);
    }
    LOGGER.info("Opened analysis cache: dir={}, memoryMaxSize={}", dir, memoryMaxSize);
    return new FileAnalysisCache(dir, objectMapper, memoryMaxSize);
  }

  @Override
  public <T> Optional<T> get(CacheKey key, Class<T> type) {
    String digest = digest(key);
    JsonNode node = memory.getIfPresent(digest);
    if (node == null) {
      node = readEntry(digest);
      if (node == null) {
        LOGGER.debug("Cache miss: key={}", key.parts());
        return Optional.empty();
      }
      memory.put(digest, node);
    }
    LOGGER.debug("Cache hit: key={}", key.parts());
    try {
      return Optional.ofNullable(canonicalMapper.treeToValue(node, type));
    } catch (JsonProcessingException e) {
      LOGGER.warn("Cached entry for {} does not decode as {}, treating as miss", key.parts(), type);
      return Optional.empty();
    }
  }

  @Override
  public <T> T set(CacheKey key, T value) {
    String digest = digest(key);
    JsonNode node = canonicalMapper.valueToTree(value);
    Path entry = entryPath(digest);
    Path temp = null;
    try {
      temp = Files.createTempFile(directory, digest, ".tmp");
      try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(temp))) {
        canonicalMapper.writeValue(out, node);
      }
      Files.move(temp, entry, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      deleteQuietly(temp);
      throw new CacheException("Failed to write cache entry for " + key.parts(), e);
    }
    memory.put(digest, node);
    LOGGER.debug("Cached entry: key={}, file={}", key.parts(), entry.getFileName());
    return value;
  }

  @Override
  public <T> Optional<T> pop(CacheKey key, Class<T> type) {
    Optional<T> value = get(key, type);
    String digest = digest(key);
    memory.invalidate(digest);
    try {
      if (Files.deleteIfExists(entryPath(digest))) {
        LOGGER.debug("Evicted entry: key={}", key.parts());
      }
    } catch (IOException e) {
      throw new CacheException("Failed to delete cache entry for " + key.parts(), e);
    }
    return value;
  }

  /**
   * Delete every entry, including leftovers of interrupted writes.
   *
   * @throws CacheException if an entry cannot be deleted
   */
  public void clear() {
    memory.invalidateAll();
    try (Stream<Path> files = Files.list(directory)) {
      for (Path file : files.filter(Files::isRegularFile).toList()) {
        Files.deleteIfExists(file);
      }
    } catch (IOException e) {
      throw new CacheException("Failed to clear cache directory: " + directory, e);
    }
    LOGGER.info("Cleared analysis cache: dir={}", directory);
  }

  public Path getDirectory() {
    return directory;
  }

  /** SHA-1 hex digest of the key's canonical JSON. */
  String digest(CacheKey key) {
    try {
      byte[] canonical =
          canonicalMapper.writeValueAsString(key.parts()).getBytes(StandardCharsets.UTF_8);
      return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-1").digest(canonical));
    } catch (JsonProcessingException | NoSuchAlgorithmException e) {
      throw new CacheException("Failed to hash cache key " + key.parts(), e);
    }
  }

  private Path entryPath(String digest) {
    return directory.resolve(digest + ENTRY_SUFFIX);
  }

  private JsonNode readEntry(String digest) {
    try (InputStream in = new GZIPInputStream(Files.newInputStream(entryPath(digest)))) {
      return canonicalMapper.readTree(in);
    } catch (NoSuchFileException e) {
      return null;
    } catch (IOException e) {
      LOGGER.warn("Unreadable cache entry {}, treating as miss: {}", digest, e.getMessage());
      return null;
    }
  }

  private static void deleteQuietly(Path temp) {
    if (temp == null) {
      return;
    }
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete temporary cache file {}", temp, e);
    }
  }

  @SuppressWarnings("deprecation")
  private static ObjectMapper canonical(ObjectMapper objectMapper) {
    ObjectMapper mapper = objectMapper.copy();
    mapper.configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    mapper.configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true);
    mapper.configure(SerializationFeature.INDENT_OUTPUT, false);
    return mapper;
  }
}
