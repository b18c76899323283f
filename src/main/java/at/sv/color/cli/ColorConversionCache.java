package at.sv.color.cli;

import at.sv.color.Color;
import at.sv.color.gamut.GamutMapMethod;
import at.sv.color.space.ColorSpace;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.Nullable;

/**
 * Memoizes conversions of parsed colors to a fixed destination space, optionally gamut mapped. Owned by the caller,
 * e.g. one instance per batch run.
 */
@Slf4j
public final class ColorConversionCache {

    private final ColorSpace dest;
    private final @Nullable GamutMapMethod gamutMapMethod;
    private final Cache<String, Color> cache;

    public ColorConversionCache(ColorSpace dest, @Nullable GamutMapMethod gamutMapMethod, long maximumSize) {
        this.dest = dest;
        this.gamutMapMethod = gamutMapMethod;
        cache = Caffeine.newBuilder()
                        .maximumSize(maximumSize)
                        .recordStats()
                        .build();
    }

    /**
     * Parses and converts the given CSS color, reusing earlier results for identical input.
     *
     * @throws IllegalArgumentException if the input can't be parsed
     */
    public Color convert(String input) {
        return cache.get(input.trim(), this::parseAndConvert);
    }

    private Color parseAndConvert(String input) {
        Color converted = ColorParser.parse(input).toSpace(dest);
        if (gamutMapMethod != null) {
            return converted.toGamut(gamutMapMethod);
        }
        return converted;
    }

    public CacheStats stats() {
        return cache.stats();
    }

    public void logStats() {
        log.debug("Conversion cache: {}", cache.stats());
    }
}
