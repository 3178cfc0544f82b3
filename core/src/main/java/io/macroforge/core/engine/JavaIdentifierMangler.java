package io.macroforge.core.engine;

import io.macroforge.core.spi.Mangler;
import java.text.Normalizer;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * The language's identifier mangling for JVM targets.
 *
 * <p>Rules, applied in order:
 * <ol>
 * <li>Dotted names are mangled component by component.</li>
 * <li>Leading underscores are set aside and restored at the end.</li>
 * <li>Hyphens after the first character become underscores.</li>
 * <li>If the result is still not a valid Java identifier, it receives the {@code mfx_} prefix
 * and every character that cannot appear in an identifier is spelled out as
 * {@code X<unicode name>X} (lowercase, spaces as {@code _}, hyphens as {@code H}), or
 * {@code XU<hex>X} for code points without a name.</li>
 * <li>The result is NFKC-normalized.</li>
 * </ol>
 *
 * <p>Stateless and thread-safe.
 */
public final class JavaIdentifierMangler implements Mangler {

    /** Prefix marking a name whose characters had to be escaped. */
    public static final String ESCAPE_PREFIX = "mfx_";

    private static final char DELIMITER = 'X';
    private static final Pattern ESCAPED_CHAR = Pattern.compile("X(U)?([_a-z0-9H]+?)X");
    private static final Pattern UNDERSCORE_SPLIT = Pattern.compile("(_*)(.*?)(_*)", Pattern.DOTALL);

    @Override
    public String mangle(String raw) {
        Objects.requireNonNull(raw, "identifier must not be null");
        if (raw.isEmpty()) {
            throw new IllegalArgumentException("identifier must not be empty");
        }
        if (isDotted(raw)) {
            return Arrays.stream(raw.split("\\.", -1))
                    .map(part -> part.isEmpty() ? "" : mangle(part))
                    .collect(Collectors.joining("."));
        }

        int lead = countLeadingUnderscores(raw);
        String leading = raw.substring(0, lead);
        String s = raw.substring(lead);

        if (!s.isEmpty()) {
            int first = Character.charCount(s.codePointAt(0));
            s = s.substring(0, first) + s.substring(first).replace('-', '_');
        }

        if (!isJavaIdentifier(leading + s)) {
            StringBuilder sb = new StringBuilder(ESCAPE_PREFIX);
            s.codePoints().forEach(cp -> {
                if (cp != DELIMITER && Character.isJavaIdentifierPart(cp) && !Character.isIdentifierIgnorable(cp)) {
                    sb.appendCodePoint(cp);
                } else {
                    sb.append(DELIMITER).append(characterName(cp)).append(DELIMITER);
                }
            });
            s = sb.toString();
        }

        return Normalizer.normalize(leading + s, Normalizer.Form.NFKC);
    }

    @Override
    public String unmangle(String mangled) {
        Objects.requireNonNull(mangled, "identifier must not be null");
        if (isDotted(mangled)) {
            return Arrays.stream(mangled.split("\\.", -1))
                    .map(part -> part.isEmpty() ? "" : unmangle(part))
                    .collect(Collectors.joining("."));
        }

        Matcher parts = UNDERSCORE_SPLIT.matcher(mangled);
        String prefix = "";
        String suffix = "";
        String s = mangled;
        if (parts.matches()) {
            prefix = parts.group(1);
            s = parts.group(2);
            suffix = parts.group(3);
        }

        if (s.startsWith(ESCAPE_PREFIX)) {
            s = ESCAPED_CHAR
                    .matcher(s.substring(ESCAPE_PREFIX.length()))
                    .replaceAll(m -> Matcher.quoteReplacement(decode(m.group(1) != null, m.group(2), m.group())));
        }
        return prefix + s.replace('_', '-') + suffix;
    }

    @Override
    public String escapePrefix() {
        return ESCAPE_PREFIX;
    }

    private static boolean isDotted(String s) {
        return s.indexOf('.') >= 0 && !s.chars().allMatch(c -> c == '.');
    }

    private static int countLeadingUnderscores(String s) {
        int i = 0;
        while (i < s.length() && s.charAt(i) == '_') {
            i++;
        }
        return i;
    }

    private static boolean isJavaIdentifier(String s) {
        if (s.isEmpty() || !Character.isJavaIdentifierStart(s.codePointAt(0))) {
            return false;
        }
        return s.codePoints().skip(1).allMatch(Character::isJavaIdentifierPart);
    }

    private static String characterName(int codePoint) {
        String name = Character.getName(codePoint);
        if (name == null) {
            return "U" + Integer.toHexString(codePoint);
        }
        return name.toLowerCase(Locale.ROOT).replace('-', 'H').replace(' ', '_');
    }

    private static String decode(boolean hex, String body, String original) {
        try {
            if (hex) {
                return new String(Character.toChars(Integer.parseInt(body, 16)));
            }
            String name = body.replace('_', ' ').replace('H', '-').toUpperCase(Locale.ROOT);
            return new String(Character.toChars(Character.codePointOf(name)));
        } catch (IllegalArgumentException e) {
            // not an escape this mangler produced; keep the text as written
            return original;
        }
    }
}
