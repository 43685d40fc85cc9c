package ngxlint;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.base.Strings;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.Iterators;

/**
 * The syntax tree of one configuration file.
 *
 * <p>Every node keeps the verbatim whitespace around it, so {@link Config#toSource()} reproduces
 * the parsed text byte for byte. Trees are immutable and may be shared between threads.
 */
public final class AST {

  /** Indentation used for nodes that were built in code rather than parsed. */
  public static final String DEFAULT_INDENT = "    ";

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
  @JsonSubTypes({
    @JsonSubTypes.Type(value = Directive.class, name = "Directive"),
    @JsonSubTypes.Type(value = Comment.class, name = "Comment"),
    @JsonSubTypes.Type(value = BlankLine.class, name = "BlankLine")
  })
  public interface ConfigItem {
    enum Type {
      DIRECTIVE,
      COMMENT,
      BLANK_LINE;
    }

    Type type();

    Lexer.Span span();

    @SuppressWarnings("unchecked")
    default <T extends ConfigItem> T cast() {
      return (T) this;
    }
  }

  @AutoValue
  @JsonSerialize(as = Config.class)
  public abstract static class Config {
    @JsonProperty("items")
    public abstract ImmutableList<ConfigItem> items();

    /**
     * Names of the blocks this file would be nested in when pulled in by an include, outermost
     * first. Empty for a root file.
     */
    @JsonProperty("include_context")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public abstract ImmutableList<String> includeContext();

    /** Blank lines before the first item. */
    @JsonProperty("leading_whitespace")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public abstract String leadingWhitespace();

    /** Horizontal whitespace between the last line break and the end of input. */
    @JsonProperty("trailing_whitespace")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public abstract String trailingWhitespace();

    public static Config create(Iterable<? extends ConfigItem> items) {
      return create(items, ImmutableList.of(), "", "");
    }

    public static Config create(
        Iterable<? extends ConfigItem> items,
        Iterable<String> includeContext,
        String leadingWhitespace,
        String trailingWhitespace) {
      return new AutoValue_AST_Config(
          ImmutableList.copyOf(items),
          ImmutableList.copyOf(includeContext),
          leadingWhitespace,
          trailingWhitespace);
    }

    @JsonCreator
    static Config fromJson(
        @JsonProperty("items") List<ConfigItem> items,
        @JsonProperty("include_context") List<String> includeContext,
        @JsonProperty("leading_whitespace") String leadingWhitespace,
        @JsonProperty("trailing_whitespace") String trailingWhitespace) {
      return create(
          orEmpty(items),
          orEmpty(includeContext),
          Strings.nullToEmpty(leadingWhitespace),
          Strings.nullToEmpty(trailingWhitespace));
    }

    /** A copy of this config as seen from inside the given chain of blocks. */
    public Config withIncludeContext(Iterable<String> context) {
      return create(items(), context, leadingWhitespace(), trailingWhitespace());
    }

    public boolean isIncludedFrom(String blockName) {
      return includeContext().contains(blockName);
    }

    public Optional<String> immediateParentContext() {
      return Optional.ofNullable(Iterables.getLast(includeContext(), null));
    }

    /** Top-level directives, skipping comments and blank lines. */
    public ImmutableList<Directive> directives() {
      return directivesOf(items());
    }

    /** Every directive in document order, descending into blocks. */
    public Iterable<Directive> allDirectives() {
      return () -> Iterators.transform(allDirectivesWithContext().iterator(), c -> c.directive());
    }

    /**
     * Every directive in document order, paired with the names of its enclosing blocks. The
     * include context counts as enclosing blocks.
     */
    public Iterable<DirectiveWithContext> allDirectivesWithContext() {
      return () -> new DirectiveIterator(items(), includeContext());
    }

    public Stream<DirectiveWithContext> streamDirectivesWithContext() {
      return StreamSupport.stream(allDirectivesWithContext().spliterator(), false);
    }

    /** Reconstructs the source text; the exact inverse of parsing. */
    @Memoized
    public String toSource() {
      SourceWriter writer = new SourceWriter();
      writer.out.append(leadingWhitespace());
      writer.writeItems(items(), 0);
      writer.out.append(trailingWhitespace());
      return writer.out.toString();
    }
  }

  @AutoValue
  @JsonTypeName("Directive")
  @JsonSerialize(as = Directive.class)
  public abstract static class Directive implements ConfigItem {
    @JsonProperty("name")
    public abstract String name();

    /** The quoted source form of the name, when the name was written as a string. */
    @JsonProperty("name_raw")
    @JsonInclude(JsonInclude.Include.NON_ABSENT)
    public abstract Optional<String> nameRaw();

    @JsonProperty("name_span")
    public abstract Lexer.Span nameSpan();

    @JsonProperty("args")
    public abstract ImmutableList<Argument> args();

    @JsonProperty("block")
    @JsonInclude(JsonInclude.Include.NON_ABSENT)
    public abstract Optional<Block> block();

    /** From the first character of the name to the terminating ';' or '}'. */
    @JsonProperty("span")
    @Override
    public abstract Lexer.Span span();

    @JsonProperty("trailing_comment")
    @JsonInclude(JsonInclude.Include.NON_ABSENT)
    public abstract Optional<Comment> trailingComment();

    @JsonProperty("leading_whitespace")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public abstract String leadingWhitespace();

    /** Everything between the last argument and the ';' or '{'. */
    @JsonProperty("space_before_terminator")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public abstract String spaceBeforeTerminator();

    /** Horizontal whitespace after the ';' or '{' up to the end of the line. */
    @JsonProperty("trailing_whitespace")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public abstract String trailingWhitespace();

    /** Whether a line break follows the ';' or '{' (and any trailing comment). */
    @JsonProperty("line_break")
    public abstract boolean lineBreak();

    @Override
    public Type type() {
      return Type.DIRECTIVE;
    }

    public boolean is(String name) {
      return name().equals(name);
    }

    public Optional<String> firstArg() {
      return args().isEmpty() ? Optional.empty() : Optional.of(args().get(0).value());
    }

    public boolean firstArgIs(String value) {
      return firstArg().map(value::equals).orElse(false);
    }

    public boolean hasBlock() {
      return block().isPresent();
    }

    public abstract Builder toBuilder();

    public static Builder builder(String name) {
      return new AutoValue_AST_Directive.Builder()
          .setName(name)
          .setNameSpan(Lexer.Span.none())
          .setArgs(ImmutableList.of())
          .setSpan(Lexer.Span.none())
          .setLeadingWhitespace("")
          .setSpaceBeforeTerminator("")
          .setTrailingWhitespace("")
          .setLineBreak(true);
    }

    @JsonCreator
    static Directive fromJson(
        @JsonProperty("name") String name,
        @JsonProperty("name_raw") String nameRaw,
        @JsonProperty("name_span") Lexer.Span nameSpan,
        @JsonProperty("args") List<Argument> args,
        @JsonProperty("block") Block block,
        @JsonProperty("span") Lexer.Span span,
        @JsonProperty("trailing_comment") Comment trailingComment,
        @JsonProperty("leading_whitespace") String leadingWhitespace,
        @JsonProperty("space_before_terminator") String spaceBeforeTerminator,
        @JsonProperty("trailing_whitespace") String trailingWhitespace,
        @JsonProperty("line_break") Boolean lineBreak) {
      return builder(name)
          .setNameRaw(Optional.ofNullable(nameRaw))
          .setNameSpan(orNone(nameSpan))
          .setArgs(orEmpty(args))
          .setBlock(Optional.ofNullable(block))
          .setSpan(orNone(span))
          .setTrailingComment(Optional.ofNullable(trailingComment))
          .setLeadingWhitespace(Strings.nullToEmpty(leadingWhitespace))
          .setSpaceBeforeTerminator(Strings.nullToEmpty(spaceBeforeTerminator))
          .setTrailingWhitespace(Strings.nullToEmpty(trailingWhitespace))
          .setLineBreak(lineBreak == null || lineBreak)
          .build();
    }

    @AutoValue.Builder
    public abstract static class Builder {
      public abstract Builder setName(String name);

      public abstract Builder setNameRaw(Optional<String> nameRaw);

      public abstract Builder setNameSpan(Lexer.Span nameSpan);

      public abstract Builder setArgs(Iterable<Argument> args);

      public abstract Builder setBlock(Optional<Block> block);

      public abstract Builder setBlock(Block block);

      public abstract Builder setSpan(Lexer.Span span);

      public abstract Builder setTrailingComment(Optional<Comment> trailingComment);

      public abstract Builder setTrailingComment(Comment trailingComment);

      public abstract Builder setLeadingWhitespace(String leadingWhitespace);

      public abstract Builder setSpaceBeforeTerminator(String spaceBeforeTerminator);

      public abstract Builder setTrailingWhitespace(String trailingWhitespace);

      public abstract Builder setLineBreak(boolean lineBreak);

      public abstract Directive build();
    }
  }

  @AutoValue
  @JsonSerialize(as = Block.class)
  public abstract static class Block {
    @JsonProperty("items")
    public abstract ImmutableList<ConfigItem> items();

    /** From the '{' through the '}'. */
    @JsonProperty("span")
    public abstract Lexer.Span span();

    /**
     * The trimmed body of a block whose contents are not configuration syntax, with tokens on a
     * line joined by single spaces and line starts unindented.
     */
    @JsonProperty("raw_content")
    @JsonInclude(JsonInclude.Include.NON_ABSENT)
    public abstract Optional<String> rawContent();

    /** The trimmed body exactly as written, present only when it differs from the raw content. */
    @JsonProperty("raw_source")
    @JsonInclude(JsonInclude.Include.NON_ABSENT)
    public abstract Optional<String> rawSource();

    /** Blank lines after the opening line, or the whitespace before raw content. */
    @JsonProperty("leading_whitespace")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public abstract String leadingWhitespace();

    @JsonProperty("closing_brace_leading_whitespace")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public abstract String closingBraceLeadingWhitespace();

    @JsonProperty("trailing_whitespace")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public abstract String trailingWhitespace();

    /** Whether a line break follows the '}' (and any trailing comment). */
    @JsonProperty("line_break")
    public abstract boolean lineBreak();

    public boolean isRaw() {
      return rawContent().isPresent();
    }

    public ImmutableList<Directive> directives() {
      return directivesOf(items());
    }

    public abstract Builder toBuilder();

    public static Builder builder() {
      return new AutoValue_AST_Block.Builder()
          .setItems(ImmutableList.of())
          .setSpan(Lexer.Span.none())
          .setLeadingWhitespace("")
          .setClosingBraceLeadingWhitespace("")
          .setTrailingWhitespace("")
          .setLineBreak(true);
    }

    @JsonCreator
    static Block fromJson(
        @JsonProperty("items") List<ConfigItem> items,
        @JsonProperty("span") Lexer.Span span,
        @JsonProperty("raw_content") String rawContent,
        @JsonProperty("raw_source") String rawSource,
        @JsonProperty("leading_whitespace") String leadingWhitespace,
        @JsonProperty("closing_brace_leading_whitespace") String closingBraceLeadingWhitespace,
        @JsonProperty("trailing_whitespace") String trailingWhitespace,
        @JsonProperty("line_break") Boolean lineBreak) {
      return builder()
          .setItems(orEmpty(items))
          .setSpan(orNone(span))
          .setRawContent(Optional.ofNullable(rawContent))
          .setRawSource(Optional.ofNullable(rawSource))
          .setLeadingWhitespace(Strings.nullToEmpty(leadingWhitespace))
          .setClosingBraceLeadingWhitespace(Strings.nullToEmpty(closingBraceLeadingWhitespace))
          .setTrailingWhitespace(Strings.nullToEmpty(trailingWhitespace))
          .setLineBreak(lineBreak == null || lineBreak)
          .build();
    }

    @AutoValue.Builder
    public abstract static class Builder {
      public abstract Builder setItems(Iterable<? extends ConfigItem> items);

      public abstract Builder setSpan(Lexer.Span span);

      public abstract Builder setRawContent(Optional<String> rawContent);

      public abstract Builder setRawContent(String rawContent);

      public abstract Builder setRawSource(Optional<String> rawSource);

      public abstract Builder setRawSource(String rawSource);

      public abstract Builder setLeadingWhitespace(String leadingWhitespace);

      public abstract Builder setClosingBraceLeadingWhitespace(String whitespace);

      public abstract Builder setTrailingWhitespace(String trailingWhitespace);

      public abstract Builder setLineBreak(boolean lineBreak);

      public abstract Block build();
    }
  }

  @AutoValue
  @JsonSerialize(as = Argument.class)
  public abstract static class Argument {
    public enum Kind {
      @JsonProperty("Literal")
      LITERAL,
      @JsonProperty("QuotedString")
      QUOTED_STRING,
      @JsonProperty("SingleQuotedString")
      SINGLE_QUOTED_STRING,
      @JsonProperty("Variable")
      VARIABLE;
    }

    @JsonProperty("kind")
    public abstract Kind kind();

    /** Quotes stripped, escapes resolved, '$' dropped from variables. */
    @JsonProperty("value")
    public abstract String value();

    /** The source text of the argument; reconstruction uses this, never the value. */
    @JsonProperty("raw")
    public abstract String raw();

    @JsonProperty("span")
    public abstract Lexer.Span span();

    /** Verbatim text since the previous token. May hold line breaks and comments. */
    @JsonProperty("leading_whitespace")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public abstract String leadingWhitespace();

    public static Argument create(
        Kind kind, String value, String raw, Lexer.Span span, String leadingWhitespace) {
      return new AutoValue_AST_Argument(kind, value, raw, span, leadingWhitespace);
    }

    @JsonCreator
    static Argument fromJson(
        @JsonProperty("kind") Kind kind,
        @JsonProperty("value") String value,
        @JsonProperty("raw") String raw,
        @JsonProperty("span") Lexer.Span span,
        @JsonProperty("leading_whitespace") String leadingWhitespace) {
      return create(kind, value, raw, orNone(span), Strings.nullToEmpty(leadingWhitespace));
    }

    public static Argument literal(String value) {
      return create(Kind.LITERAL, value, value, Lexer.Span.none(), "");
    }

    public boolean isOn() {
      return value().equals("on");
    }

    public boolean isOff() {
      return value().equals("off");
    }

    public boolean isVariable() {
      return kind() == Kind.VARIABLE;
    }

    public boolean isQuoted() {
      return kind() == Kind.QUOTED_STRING || kind() == Kind.SINGLE_QUOTED_STRING;
    }

    public boolean isLiteral() {
      return kind() == Kind.LITERAL;
    }
  }

  @AutoValue
  @JsonTypeName("Comment")
  @JsonSerialize(as = Comment.class)
  public abstract static class Comment implements ConfigItem {
    /** Includes the leading '#', excludes trailing whitespace. */
    @JsonProperty("text")
    public abstract String text();

    @JsonProperty("span")
    @Override
    public abstract Lexer.Span span();

    @JsonProperty("leading_whitespace")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public abstract String leadingWhitespace();

    @JsonProperty("trailing_whitespace")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public abstract String trailingWhitespace();

    /** Whether the comment's line ends in a line break. Unused for trailing comments. */
    @JsonProperty("line_break")
    public abstract boolean lineBreak();

    @Override
    public Type type() {
      return Type.COMMENT;
    }

    public static Comment create(
        String text,
        Lexer.Span span,
        String leadingWhitespace,
        String trailingWhitespace,
        boolean lineBreak) {
      return new AutoValue_AST_Comment(
          text, span, leadingWhitespace, trailingWhitespace, lineBreak);
    }

    public static Comment of(String text) {
      return create(text, Lexer.Span.none(), "", "", true);
    }

    @JsonCreator
    static Comment fromJson(
        @JsonProperty("text") String text,
        @JsonProperty("span") Lexer.Span span,
        @JsonProperty("leading_whitespace") String leadingWhitespace,
        @JsonProperty("trailing_whitespace") String trailingWhitespace,
        @JsonProperty("line_break") Boolean lineBreak) {
      return create(
          text,
          orNone(span),
          Strings.nullToEmpty(leadingWhitespace),
          Strings.nullToEmpty(trailingWhitespace),
          lineBreak == null || lineBreak);
    }
  }

  @AutoValue
  @JsonTypeName("BlankLine")
  @JsonSerialize(as = BlankLine.class)
  public abstract static class BlankLine implements ConfigItem {
    @JsonProperty("span")
    @Override
    public abstract Lexer.Span span();

    /** The whitespace-only text of the line. */
    @JsonProperty("content")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public abstract String content();

    @Override
    public Type type() {
      return Type.BLANK_LINE;
    }

    @JsonCreator
    public static BlankLine create(
        @JsonProperty("span") Lexer.Span span, @JsonProperty("content") String content) {
      return new AutoValue_AST_BlankLine(orNone(span), Strings.nullToEmpty(content));
    }
  }

  /** A directive with the names of the blocks enclosing it, outermost first. */
  @AutoValue
  public abstract static class DirectiveWithContext {
    public abstract Directive directive();

    public abstract ImmutableList<String> parentStack();

    public static DirectiveWithContext create(Directive directive, List<String> parentStack) {
      return new AutoValue_AST_DirectiveWithContext(directive, ImmutableList.copyOf(parentStack));
    }

    public int depth() {
      return parentStack().size();
    }

    public Optional<String> parent() {
      return Optional.ofNullable(Iterables.getLast(parentStack(), null));
    }

    public boolean isInside(String blockName) {
      return parentStack().contains(blockName);
    }

    public boolean parentIs(String blockName) {
      return parent().map(blockName::equals).orElse(false);
    }

    public boolean isAtRoot() {
      return parentStack().isEmpty();
    }
  }

  // Depth-first walk over an explicit stack of sibling iterators, so deep nesting cannot
  // overflow the call stack.
  private static final class DirectiveIterator extends AbstractIterator<DirectiveWithContext> {
    private final Deque<Iterator<ConfigItem>> stack = new ArrayDeque<>();
    private final List<String> parents;

    private DirectiveIterator(List<ConfigItem> items, List<String> initialContext) {
      this.stack.push(items.iterator());
      this.parents = new ArrayList<>(initialContext);
    }

    @Override
    protected DirectiveWithContext computeNext() {
      while (!stack.isEmpty()) {
        Iterator<ConfigItem> siblings = stack.peek();
        if (!siblings.hasNext()) {
          stack.pop();
          if (!stack.isEmpty()) {
            parents.remove(parents.size() - 1);
          }
          continue;
        }

        ConfigItem item = siblings.next();
        if (item.type() != ConfigItem.Type.DIRECTIVE) continue;

        Directive directive = item.cast();
        DirectiveWithContext result = DirectiveWithContext.create(directive, parents);
        if (directive.block().isPresent()) {
          parents.add(directive.name());
          stack.push(directive.block().get().items().iterator());
        }
        return result;
      }
      return endOfData();
    }
  }

  private static final class SourceWriter {
    private final StringBuilder out = new StringBuilder();

    void writeItems(List<ConfigItem> items, int depth) {
      for (ConfigItem item : items) {
        switch (item.type()) {
          case DIRECTIVE:
            writeDirective(item.cast(), depth);
            break;
          case COMMENT:
            {
              Comment comment = item.cast();
              out.append(indent(comment.leadingWhitespace(), comment.span(), depth))
                  .append(comment.text())
                  .append(comment.trailingWhitespace());
              lineBreak(comment.lineBreak());
              break;
            }
          case BLANK_LINE:
            out.append(item.<BlankLine>cast().content()).append('\n');
            break;
        }
      }
    }

    private void writeDirective(Directive directive, int depth) {
      String indent = indent(directive.leadingWhitespace(), directive.span(), depth);
      out.append(indent).append(directive.nameRaw().orElse(directive.name()));
      for (Argument arg : directive.args()) {
        out.append(syntheticDefault(arg.leadingWhitespace(), arg.span(), " ")).append(arg.raw());
      }
      if (!directive.block().isPresent()) {
        out.append(directive.spaceBeforeTerminator())
            .append(';')
            .append(directive.trailingWhitespace());
        writeTrailingComment(directive);
        lineBreak(directive.lineBreak());
        return;
      }

      Block block = directive.block().get();
      out.append(syntheticDefault(directive.spaceBeforeTerminator(), directive.span(), " "))
          .append('{')
          .append(directive.trailingWhitespace());
      lineBreak(directive.lineBreak());
      if (block.isRaw()) {
        String body = block.rawSource().orElse(block.rawContent().get());
        String bodyIndent = body.isEmpty() ? "" : indent + DEFAULT_INDENT;
        out.append(syntheticDefault(block.leadingWhitespace(), block.span(), bodyIndent))
            .append(body)
            .append(
                syntheticDefault(
                    block.closingBraceLeadingWhitespace(),
                    block.span(),
                    body.isEmpty() ? indent : "\n" + indent));
      } else {
        out.append(block.leadingWhitespace());
        writeItems(block.items(), depth + 1);
        out.append(syntheticDefault(block.closingBraceLeadingWhitespace(), block.span(), indent));
      }
      out.append('}').append(block.trailingWhitespace());
      writeTrailingComment(directive);
      lineBreak(block.lineBreak());
    }

    private void writeTrailingComment(Directive directive) {
      if (directive.trailingComment().isPresent()) {
        Comment comment = directive.trailingComment().get();
        out.append(syntheticDefault(comment.leadingWhitespace(), comment.span(), " "))
            .append(comment.text())
            .append(comment.trailingWhitespace());
      }
    }

    private void lineBreak(boolean present) {
      if (present) out.append('\n');
    }

    private static String indent(String stored, Lexer.Span span, int depth) {
      return syntheticDefault(stored, span, Strings.repeat(DEFAULT_INDENT, depth));
    }

    // Parsed nodes always reproduce what they stored, even when it is empty.
    private static String syntheticDefault(String stored, Lexer.Span span, String fallback) {
      return stored.isEmpty() && span.isSynthetic() ? fallback : stored;
    }
  }

  private static ImmutableList<Directive> directivesOf(List<ConfigItem> items) {
    return items.stream()
        .filter(i -> i.type() == ConfigItem.Type.DIRECTIVE)
        .map(i -> i.<Directive>cast())
        .collect(ImmutableList.toImmutableList());
  }

  private static <T> List<T> orEmpty(List<T> list) {
    return list == null ? ImmutableList.of() : list;
  }

  private static Lexer.Span orNone(Lexer.Span span) {
    return span == null ? Lexer.Span.none() : span;
  }

  private AST() {}
}
