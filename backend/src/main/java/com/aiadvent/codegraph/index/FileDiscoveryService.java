package com.aiadvent.codegraph.index;

import com.aiadvent.codegraph.config.CodeGraphProperties;
import com.aiadvent.codegraph.parser.SourceParser;
import com.aiadvent.codegraph.parser.model.Language;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Walks a repository checkout and returns the source files the parser can handle. */
@Service
public class FileDiscoveryService {

  private static final Logger log = LoggerFactory.getLogger(FileDiscoveryService.class);

  private static final char REPLACEMENT = '\uFFFD';

  private static final Set<String> BINARY_EXTENSIONS =
      Set.of(
          "png", "jpg", "jpeg", "gif", "bin", "exe", "dll", "so", "dylib", "class", "jar", "zip",
          "tar", "gz", "pdf", "ico", "woff", "woff2");

  private final CodeGraphProperties properties;
  private final SourceParser sourceParser;

  public FileDiscoveryService(CodeGraphProperties properties, SourceParser sourceParser) {
    this.properties = properties;
    this.sourceParser = sourceParser;
  }

  public List<DiscoveredFile> discover(Path root) {
    Path normalizedRoot = root.toAbsolutePath().normalize();
    if (!Files.isDirectory(normalizedRoot)) {
      throw new IllegalArgumentException("Repository root is not a directory: " + root);
    }
    List<DiscoveredFile> files = new ArrayList<>();
    long maxSize = properties.getParsing().getMaxFileSizeBytes();
    try {
      Files.walkFileTree(
          normalizedRoot,
          new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
              if (dir.equals(normalizedRoot)) {
                return FileVisitResult.CONTINUE;
              }
              return shouldSkipDirectory(dir.getFileName().toString())
                  ? FileVisitResult.SKIP_SUBTREE
                  : FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
                throws IOException {
              if (!attrs.isRegularFile() || Files.isHidden(file) || Files.isSymbolicLink(file)) {
                return FileVisitResult.CONTINUE;
              }
              String relativePath =
                  normalizedRoot.relativize(file.toAbsolutePath().normalize())
                      .toString()
                      .replace('\\', '/');
              Optional<Language> language = Language.fromPath(relativePath);
              if (language.isEmpty() || !sourceParser.supports(language.get())) {
                return FileVisitResult.CONTINUE;
              }
              if (attrs.size() > maxSize) {
                log.warn(
                    "Skipped oversized file (file={}, sizeBytes={}, limit={})",
                    relativePath,
                    attrs.size(),
                    maxSize);
                return FileVisitResult.CONTINUE;
              }
              if (isBinaryFile(file)) {
                log.debug("Skipped binary file {}", relativePath);
                return FileVisitResult.CONTINUE;
              }
              byte[] rawBytes;
              try {
                rawBytes = Files.readAllBytes(file);
              } catch (IOException ex) {
                log.warn("Failed to read {}: {}", relativePath, ex.getMessage());
                return FileVisitResult.CONTINUE;
              }
              String content = decodeUtf8(rawBytes);
              if (content.indexOf(REPLACEMENT) >= 0) {
                log.debug("Replaced invalid UTF-8 sequences in {}", relativePath);
              }
              files.add(
                  new DiscoveredFile(
                      relativePath, language.get(), content, hashBytes(rawBytes), rawBytes.length));
              return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException ex) {
              log.warn("Failed to visit {}: {}", file, ex.getMessage());
              return FileVisitResult.CONTINUE;
            }
          });
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to walk repository " + normalizedRoot, ex);
    }
    files.sort(Comparator.comparing(DiscoveredFile::relativePath));
    return files;
  }

  private boolean shouldSkipDirectory(String dirName) {
    String lower = dirName.toLowerCase(Locale.ROOT);
    return properties.getParsing().getIgnoredDirectories().stream()
        .map(entry -> entry.toLowerCase(Locale.ROOT))
        .anyMatch(lower::equals);
  }

  private boolean isBinaryFile(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    if (dot > 0 && BINARY_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT))) {
      return true;
    }
    byte[] buffer = new byte[1024];
    try (InputStream input = new BufferedInputStream(Files.newInputStream(file))) {
      int read = input.read(buffer);
      if (read <= 0) {
        return false;
      }
      int nonPrintable = 0;
      for (int i = 0; i < read; i++) {
        int b = buffer[i] & 0xFF;
        if (b == 0) {
          return true;
        }
        if (b < 0x09 || (b > 0x0A && b < 0x20 && b != 0x0D)) {
          nonPrintable++;
        }
      }
      return nonPrintable > read * 0.3;
    } catch (IOException ex) {
      log.debug("Unable to inspect file {}, treating as binary: {}", file, ex.getMessage());
      return true;
    }
  }

  static String hashBytes(byte[] data) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return bytesToHex(digest.digest(data));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 algorithm is not available", ex);
    }
  }

  /** Decodes as UTF-8; invalid sequences become U+FFFD so the file is still indexed. */
  static String decodeUtf8(byte[] data) {
    CharsetDecoder decoder =
        StandardCharsets.UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
    try {
      return decoder.decode(ByteBuffer.wrap(data)).toString();
    } catch (CharacterCodingException ex) {
      throw new IllegalStateException("UTF-8 decoder rejected input in replace mode", ex);
    }
  }

  private static String bytesToHex(byte[] hash) {
    StringBuilder builder = new StringBuilder(hash.length * 2);
    for (byte b : hash) {
      builder.append(String.format("%02x", b));
    }
    return builder.toString();
  }
}
