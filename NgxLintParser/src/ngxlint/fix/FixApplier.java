package ngxlint.fix;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Bytes;

/**
 * Applies a collected set of fixes to the source they were computed against.
 *
 * <p>Range fixes go first, right to left, so offsets into the original text stay valid without
 * rebasing. A range fix that overlaps one already applied is dropped. Line fixes follow on the
 * result, bottom line first. Invalid fixes are skipped rather than reported; compare {@link
 * Result#appliedCount()} with the number offered to detect drops.
 */
public final class FixApplier {
  private static final Logger logger = LoggerFactory.getLogger(FixApplier.class);

  @AutoValue
  public abstract static class Result {
    public abstract String content();

    public abstract int appliedCount();

    static Result create(String content, int appliedCount) {
      return new AutoValue_FixApplier_Result(content, appliedCount);
    }
  }

  public static Result apply(String source, Iterable<Fix> fixes) {
    List<Fix> rangeFixes = new ArrayList<>();
    List<Fix> lineFixes = new ArrayList<>();
    for (Fix fix : fixes) {
      (fix.isRangeBased() ? rangeFixes : lineFixes).add(fix);
    }

    int applied = 0;
    String content = source;
    if (!rangeFixes.isEmpty()) {
      RangePass pass = new RangePass(content.getBytes(StandardCharsets.UTF_8));
      applied += pass.run(rangeFixes);
      content = new String(pass.bytes, StandardCharsets.UTF_8);
    }
    if (!lineFixes.isEmpty()) {
      LinePass pass = new LinePass(content);
      applied += pass.run(lineFixes);
      content = pass.join();
    }

    logger.debug("Applied {} of {} fixes", applied, rangeFixes.size() + lineFixes.size());
    return Result.create(content, applied);
  }

  private static final class RangePass {
    private byte[] bytes;
    private final List<int[]> appliedExtents = new ArrayList<>();

    RangePass(byte[] bytes) {
      this.bytes = bytes;
    }

    int run(List<Fix> fixes) {
      List<Fix> sorted = new ArrayList<>(fixes);
      sorted.sort(Comparator.comparingInt((Fix f) -> f.startOffset().getAsInt()).reversed());

      int applied = 0;
      for (Fix fix : sorted) {
        int start = fix.startOffset().getAsInt();
        int end = fix.endOffset().getAsInt();
        if (start < 0
            || start > end
            || end > bytes.length
            || !isCharBoundary(start)
            || !isCharBoundary(end)) {
          logger.debug("Dropping fix [{}, {}): outside the source", start, end);
          continue;
        }
        if (overlapsApplied(start, end)) {
          logger.debug("Dropping fix [{}, {}): overlaps an applied fix", start, end);
          continue;
        }

        byte[] replacement = fix.newText().getBytes(StandardCharsets.UTF_8);
        bytes =
            Bytes.concat(
                Arrays.copyOfRange(bytes, 0, start),
                replacement,
                Arrays.copyOfRange(bytes, end, bytes.length));
        appliedExtents.add(new int[] {start, start + replacement.length});
        applied++;
      }
      return applied;
    }

    private boolean overlapsApplied(int start, int end) {
      for (int[] extent : appliedExtents) {
        if (start < extent[1] && end > extent[0]) return true;
      }
      return false;
    }

    // Offsets must not split a multi-byte character.
    private boolean isCharBoundary(int offset) {
      return offset == bytes.length || (bytes[offset] & 0xC0) != 0x80;
    }
  }

  private static final class LinePass {
    private final List<String> lines;
    private final boolean trailingNewline;

    LinePass(String content) {
      trailingNewline = content.endsWith("\n");
      String body = trailingNewline ? content.substring(0, content.length() - 1) : content;
      lines =
          body.isEmpty() && !trailingNewline
              ? new ArrayList<>()
              : new ArrayList<>(Arrays.asList(body.split("\n", -1)));
    }

    int run(List<Fix> fixes) {
      int applied = 0;
      for (Fix fix : order(fixes)) {
        if (apply(fix)) {
          applied++;
        } else {
          logger.debug("Dropping fix for line {}: no such line or text", fix.line());
        }
      }
      return applied;
    }

    private boolean apply(Fix fix) {
      if (fix.line() <= 0) return false;

      if (fix.insertAfter()) {
        lines.add(Math.min(fix.line(), lines.size()), fix.newText());
        return true;
      }
      if (fix.line() > lines.size()) return false;

      int index = fix.line() - 1;
      if (fix.deleteLine()) {
        lines.remove(index);
        return true;
      }
      if (fix.oldText().isPresent()) {
        String line = lines.get(index);
        String oldText = fix.oldText().get();
        int at = line.indexOf(oldText);
        if (at < 0) return false;
        lines.set(
            index, line.substring(0, at) + fix.newText() + line.substring(at + oldText.length()));
        return true;
      }
      lines.set(index, fix.newText());
      return true;
    }

    String join() {
      if (lines.isEmpty()) return "";
      String joined = Joiner.on('\n').join(lines);
      return trailingNewline ? joined + "\n" : joined;
    }

    /**
     * Bottom line first. Several insertions after one line are applied least-indented first, so
     * the most indented text ends up on top.
     */
    private static ImmutableList<Fix> order(List<Fix> fixes) {
      List<Fix> sorted = new ArrayList<>(fixes);
      sorted.sort(Comparator.comparingInt(Fix::line).reversed());

      List<Fix> result = new ArrayList<>(sorted.size());
      int i = 0;
      while (i < sorted.size()) {
        int j = i;
        while (j < sorted.size() && sorted.get(j).line() == sorted.get(i).line()) j++;
        result.addAll(orderWithinLine(sorted.subList(i, j)));
        i = j;
      }
      return ImmutableList.copyOf(result);
    }

    // Insertions are re-ordered among their own slots; other fixes keep their place.
    private static List<Fix> orderWithinLine(List<Fix> group) {
      List<Fix> inserts = new ArrayList<>();
      for (Fix fix : group) {
        if (fix.insertAfter()) inserts.add(fix);
      }
      inserts.sort(Comparator.comparingInt(FixApplier::indentOf));

      List<Fix> result = new ArrayList<>(group.size());
      int next = 0;
      for (Fix fix : group) {
        result.add(fix.insertAfter() ? inserts.get(next++) : fix);
      }
      return result;
    }
  }

  private static int indentOf(Fix fix) {
    String text = fix.newText();
    return text.length() - CharMatcher.whitespace().trimLeadingFrom(text).length();
  }

  private FixApplier() {}
}
