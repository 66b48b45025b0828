package ca.gc.cra.harvest.domain.tail;

import ca.gc.cra.harvest.validation.Strings;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Naming convention of instrument export files.
 * <p><strong>Why:</strong> The instrument software names exports {@code <prefix><source> <suffix>.csv}; the
 * {@code source} segment identifies which instrument produced the rows.</p>
 * <p><strong>Role:</strong> Domain value used by the export file set to select files and derive their source.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class ExportFileNames {
  /** Prefix used by the instrument's auto-export feature. */
  public static final String DEFAULT_PREFIX = "AutoExportTrace_";

  private static final String EXTENSION = ".csv";

  private final String prefix;
  private final Pattern sourcePattern;

  /**
   * Creates a naming convention for the given prefix.
   *
   * @param prefix literal file name prefix; must be non-blank and free of path separators
   */
  public ExportFileNames(String prefix) {
    String sanitized = Strings.requireNonBlank("filePrefix", prefix);
    if (sanitized.indexOf('/') >= 0 || sanitized.indexOf('\\') >= 0) {
      throw new IllegalArgumentException("filePrefix must not contain path separators");
    }
    this.prefix = sanitized;
    this.sourcePattern =
        Pattern.compile(Pattern.quote(sanitized) + "(\\S+)\\s", Pattern.CASE_INSENSITIVE);
  }

  /**
   * Returns the default convention ({@value #DEFAULT_PREFIX}).
   *
   * @return default naming convention
   */
  public static ExportFileNames defaults() {
    return new ExportFileNames(DEFAULT_PREFIX);
  }

  public String prefix() {
    return prefix;
  }

  /**
   * Returns the directory glob selecting export files, e.g. {@code AutoExportTrace_*.csv}.
   *
   * @return glob pattern understood by {@link java.nio.file.Files#newDirectoryStream(Path, String)}
   */
  public String glob() {
    return escapeGlob(prefix) + "*" + EXTENSION;
  }

  /**
   * Reports whether a file name follows the convention.
   *
   * @param fileName bare file name
   * @return {@code true} when the name starts with the prefix and ends with {@code .csv}
   */
  public boolean matches(String fileName) {
    return fileName != null
        && fileName.startsWith(prefix)
        && fileName.length() > prefix.length() + EXTENSION.length() - 1
        && fileName.endsWith(EXTENSION);
  }

  /**
   * Derives the instrument source from a file path.
   *
   * <p>The source is the non-whitespace run between the prefix and the next whitespace character
   * (case-insensitive prefix). When no whitespace follows, everything after the first occurrence of the
   * prefix up to the first space is used; when the prefix is absent the whole file name is returned.</p>
   *
   * @param path export file path; must not be {@code null}
   * @return derived source identifier
   */
  public String sourceOf(Path path) {
    Objects.requireNonNull(path, "path");
    Path fileName = path.getFileName();
    String base = fileName == null ? path.toString() : fileName.toString();
    Matcher matcher = sourcePattern.matcher(base);
    if (matcher.find()) {
      return matcher.group(1);
    }
    int idx = base.indexOf(prefix);
    if (idx < 0) {
      idx = base.toLowerCase(Locale.ROOT).indexOf(prefix.toLowerCase(Locale.ROOT));
    }
    if (idx < 0) {
      return base;
    }
    String after = base.substring(idx + prefix.length());
    int space = after.indexOf(' ');
    return space < 0 ? after : after.substring(0, space);
  }

  private static String escapeGlob(String literal) {
    StringBuilder sb = new StringBuilder(literal.length() + 4);
    for (int i = 0; i < literal.length(); i++) {
      char c = literal.charAt(i);
      if ("*?[]{}\\".indexOf(c) >= 0) {
        sb.append('\\');
      }
      sb.append(c);
    }
    return sb.toString();
  }
}
