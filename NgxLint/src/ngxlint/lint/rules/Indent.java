package ngxlint.lint.rules;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import ngxlint.AST;
import ngxlint.AST.ConfigItem;
import ngxlint.Lexer;
import ngxlint.fix.Fix;
import ngxlint.lint.LintConfig;
import ngxlint.lint.LintError;
import ngxlint.lint.LintRule;

/**
 * Checks that every directive, comment and closing brace starting a line is indented by
 * {@code depth * indentSize} spaces, where depth counts enclosing blocks within the file.
 */
public class Indent implements LintRule {

  public static final String NAME = "indent";

  private static final CharMatcher HORIZONTAL_WHITESPACE = CharMatcher.anyOf(" \t");

  private final int indentSize;

  public Indent() {
    this(LintConfig.DEFAULT_INDENT_SIZE);
  }

  public Indent(int indentSize) {
    Preconditions.checkArgument(indentSize > 0, "indentSize must be positive: %s", indentSize);
    this.indentSize = indentSize;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public String category() {
    return "style";
  }

  @Override
  public String description() {
    return "Checks for consistent indentation";
  }

  /** One level of the walk: the items of a block, and where the cursor is. */
  private static class Frame {
    final ImmutableList<ConfigItem> items;
    final int depth;
    final Optional<AST.Directive> owner;
    int next = 0;
    boolean atLineStart;

    Frame(
        ImmutableList<ConfigItem> items,
        int depth,
        Optional<AST.Directive> owner,
        boolean atLineStart) {
      this.items = items;
      this.depth = depth;
      this.owner = owner;
      this.atLineStart = atLineStart;
    }
  }

  @Override
  public List<LintError> check(AST.Config config, String source) {
    ImmutableList.Builder<LintError> errors = ImmutableList.builder();
    Deque<Frame> stack = new ArrayDeque<>();
    stack.push(new Frame(config.items(), 0, Optional.empty(), true));

    while (!stack.isEmpty()) {
      Frame frame = stack.peek();
      if (frame.next == frame.items.size()) {
        stack.pop();
        if (frame.owner.isPresent()) {
          AST.Block block = frame.owner.get().block().get();
          if (frame.atLineStart) {
            String indent = block.closingBraceLeadingWhitespace();
            checkClosingBrace(block, indent, frame.depth - 1, errors);
          }
          stack.peek().atLineStart = block.lineBreak();
        }
        continue;
      }

      ConfigItem item = frame.items.get(frame.next++);
      switch (item.type()) {
        case BLANK_LINE:
          frame.atLineStart = true;
          break;
        case COMMENT:
          {
            AST.Comment comment = item.cast();
            if (frame.atLineStart) {
              check(comment.leadingWhitespace(), comment.span().start(), frame.depth, errors);
            }
            frame.atLineStart = comment.lineBreak();
            break;
          }
        case DIRECTIVE:
          {
            AST.Directive directive = item.cast();
            if (frame.atLineStart) {
              check(directive.leadingWhitespace(), directive.span().start(), frame.depth, errors);
            }
            if (!directive.block().isPresent()) {
              frame.atLineStart = directive.lineBreak();
              break;
            }

            AST.Block block = directive.block().get();
            boolean bodyStartsLine =
                directive.lineBreak() || block.leadingWhitespace().contains("\n");
            if (block.isRaw()) {
              String closing = block.closingBraceLeadingWhitespace();
              int lastBreak = closing.lastIndexOf('\n');
              if (lastBreak != -1) {
                checkClosingBrace(block, closing.substring(lastBreak + 1), frame.depth, errors);
              }
              frame.atLineStart = block.lineBreak();
            } else {
              Frame body =
                  new Frame(block.items(), frame.depth + 1, Optional.of(directive), bodyStartsLine);
              stack.push(body);
            }
            break;
          }
      }
    }
    return errors.build();
  }

  private void checkClosingBrace(
      AST.Block block, String indent, int depth, ImmutableList.Builder<LintError> errors) {
    if (block.span().isSynthetic()) {
      return;
    }
    Lexer.Position end = block.span().end();
    Lexer.Position brace = Lexer.Position.create(end.line(), end.column() - 1, end.offset() - 1);
    check(indent, brace, depth, errors);
  }

  /** {@code start} is the position of the first character after the indentation. */
  private void check(
      String indent, Lexer.Position start, int depth, ImmutableList.Builder<LintError> errors) {
    if (start.isSynthetic() || !HORIZONTAL_WHITESPACE.matchesAllOf(indent)) {
      return;
    }

    int expected = depth * indentSize;
    Fix fix =
        Fix.replaceRange(
            start.offset() - indent.length(), start.offset(), Strings.repeat(" ", expected));
    if (indent.indexOf('\t') != -1) {
      errors.add(
          LintError.warning(NAME, category(), "Use spaces instead of tabs for indentation")
              .at(start.line(), 1)
              .withFix(fix));
    } else if (indent.length() != expected) {
      errors.add(
          LintError.warning(
                  NAME,
                  category(),
                  String.format(
                      "Expected %d spaces of indentation, found %d", expected, indent.length()))
              .at(start.line(), 1)
              .withFix(fix));
    }
  }
}
