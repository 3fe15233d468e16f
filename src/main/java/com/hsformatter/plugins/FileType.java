package com.hsformatter.plugins;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import com.hsformatter.util.LoggerUtil;

/**
 * Source file types the formatter knows, detected by extension and, for
 * files without one, by their first bytes.
 */
public enum FileType {
    HASKELL("hs"),
    HASKELL_BOOT("hs-boot"),
    UNKNOWN("");

    private static final Logger logger = LoggerUtil.getLogger(FileType.class);
    private static final Map<Path, FileType> typeCache = new ConcurrentHashMap<>();
    private static final int MAX_CACHE_SIZE = 10000;
    private static final int SNIFF_BYTES = 4096;

    // A module header, or a script shebang that runs GHC tooling.
    private static final Pattern HASKELL_CONTENT = Pattern.compile(
            "(?m)^(?:module\\s+[A-Z][\\w.]*|#!.*\\b(?:runghc|runhaskell|stack|cabal)\\b)");

    private final String extension;

    FileType(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    public static FileType detect(Path filePath) {
        FileType cached = typeCache.get(filePath);
        if (cached != null) {
            return cached;
        }
        if (typeCache.size() > MAX_CACHE_SIZE) {
            typeCache.clear();
            logger.fine("Cleared file type detection cache");
        }
        FileType type = detectByExtension(filePath);
        if (type == UNKNOWN && !_hasExtension(filePath)) {
            type = detectByContent(filePath);
        }
        typeCache.put(filePath, type);
        return type;
    }

    public static FileType detectByExtension(Path filePath) {
        String fileName = filePath.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.endsWith(".hs-boot")) {
            return HASKELL_BOOT;
        }
        if (fileName.endsWith(".hs")) {
            return HASKELL;
        }
        return UNKNOWN;
    }

    private static boolean _hasExtension(Path filePath) {
        return filePath.getFileName().toString().indexOf('.') > 0;
    }

    /**
     * Extension-less scripts are Haskell when they start with a module
     * header or a GHC shebang.
     */
    private static FileType detectByContent(Path filePath) {
        if (!Files.isRegularFile(filePath)) {
            return UNKNOWN;
        }
        try (InputStream in = Files.newInputStream(filePath)) {
            byte[] head = in.readNBytes(SNIFF_BYTES);
            String content = new String(head, StandardCharsets.UTF_8);
            return HASKELL_CONTENT.matcher(content).find() ? HASKELL : UNKNOWN;
        } catch (IOException e) {
            logger.log(Level.FINE, "Error reading file for type detection: " + filePath, e);
            return UNKNOWN;
        }
    }

    public static void clearCache() {
        typeCache.clear();
    }

    public String getDescription() {
        return switch (this) {
            case HASKELL -> "Haskell source file";
            case HASKELL_BOOT -> "Haskell boot file";
            case UNKNOWN -> "Unknown file type";
        };
    }
}
