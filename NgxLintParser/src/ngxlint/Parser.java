package ngxlint;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import ngxlint.AST.Argument;
import ngxlint.AST.Block;
import ngxlint.AST.BlankLine;
import ngxlint.AST.Comment;
import ngxlint.AST.Config;
import ngxlint.AST.ConfigItem;
import ngxlint.AST.Directive;
import ngxlint.Lexer.Position;
import ngxlint.Lexer.Span;
import ngxlint.Lexer.Token;
import ngxlint.Lexer.TokenKind;

/**
 * Recursive descent over a token list. Builds a tree whose {@link Config#toSource()} is the exact
 * input text.
 */
public class Parser {
  private static final Logger logger = LoggerFactory.getLogger(Parser.class);

  /** Directives whose names end with this take a body that is stored verbatim. */
  public static final String RAW_BLOCK_SUFFIX = "_by_lua_block";

  public static boolean isRawBlockDirective(String name) {
    return name.endsWith(RAW_BLOCK_SUFFIX);
  }

  public static Config parseString(String source) throws ParseException {
    ImmutableList<Token> tokens;
    try {
      tokens = new Lexer(source).tokenize();
    } catch (LexException e) {
      throw ParseException.lex(e);
    }
    Config config = new Parser(tokens).parse();
    logger.debug("Parsed {} tokens into {} top-level items", tokens.size(), config.items().size());
    return config;
  }

  /** Reads the file as UTF-8; malformed input fails the read, not the parse. */
  public static Config parseFile(Path path) throws IOException, ParseException {
    logger.debug("Parsing {}", path);
    return parseString(Files.readString(path, StandardCharsets.UTF_8));
  }

  // The text that ended a line: horizontal whitespace and whether a '\n' followed.
  private static final class LineEnd {
    private static final LineEnd NONE = new LineEnd("", false);

    final String whitespace;
    final boolean lineBreak;

    LineEnd(String whitespace, boolean lineBreak) {
      this.whitespace = whitespace;
      this.lineBreak = lineBreak;
    }
  }

  private final ImmutableList<Token> tokens;
  private int pos = 0;

  public Parser(ImmutableList<Token> tokens) {
    Preconditions.checkArgument(
        !tokens.isEmpty() && tokens.get(tokens.size() - 1).is(TokenKind.EOF),
        "token list must end with EOF");
    this.tokens = tokens;
  }

  public Config parse() throws ParseException {
    StringBuilder leading = new StringBuilder();
    ImmutableList<ConfigItem> items = parseItems(false, leading);
    return Config.create(
        items, ImmutableList.of(), leading.toString(), current().leadingWhitespace());
  }

  private Token current() {
    return tokens.get(Math.min(pos, tokens.size() - 1));
  }

  private Token advance() {
    Token token = current();
    if (pos < tokens.size()) pos++;
    return token;
  }

  private LineEnd finishLine() {
    if (!current().is(TokenKind.NEWLINE)) return LineEnd.NONE;
    return new LineEnd(advance().leadingWhitespace(), true);
  }

  // Stops at the matching '}' (left unconsumed) or at EOF.
  private ImmutableList<ConfigItem> parseItems(boolean inBlock, StringBuilder leading)
      throws ParseException {
    ImmutableList.Builder<ConfigItem> items = ImmutableList.builder();
    boolean sawItem = false;

    while (true) {
      Token token = current();
      switch (token.kind()) {
        case EOF:
          return items.build();
        case CLOSE_BRACE:
          if (inBlock) return items.build();
          throw ParseException.unmatchedCloseBrace(token.span().start());
        case NEWLINE:
          advance();
          if (sawItem) {
            items.add(blankLine(token));
          } else {
            // Blank lines before the first item belong to the container.
            leading.append(token.leadingWhitespace()).append('\n');
          }
          break;
        case COMMENT:
          {
            advance();
            LineEnd end = finishLine();
            items.add(
                Comment.create(
                    token.raw(),
                    token.span(),
                    token.leadingWhitespace(),
                    end.whitespace,
                    end.lineBreak));
            sawItem = true;
            break;
          }
        case IDENT:
        case ARGUMENT:
        case DOUBLE_QUOTED_STRING:
        case SINGLE_QUOTED_STRING:
          items.add(parseDirective());
          sawItem = true;
          break;
        default:
          throw ParseException.unexpectedToken(
              "directive or comment", token.kind().displayName(), token.span().start());
      }
    }
  }

  private static BlankLine blankLine(Token newline) {
    String content = newline.leadingWhitespace();
    Position nl = newline.span().start();
    // Horizontal whitespace is ASCII, so chars, columns and bytes agree.
    Position start =
        Position.create(nl.line(), nl.column() - content.length(), nl.offset() - content.length());
    return BlankLine.create(Span.create(start, newline.span().end()), content);
  }

  private Directive parseDirective() throws ParseException {
    Token nameToken = current();
    Directive.Builder directive;
    switch (nameToken.kind()) {
      case IDENT:
      case ARGUMENT:
        directive = Directive.builder(nameToken.value());
        break;
      case DOUBLE_QUOTED_STRING:
      case SINGLE_QUOTED_STRING:
        directive =
            Directive.builder(nameToken.value()).setNameRaw(Optional.of(nameToken.raw()));
        break;
      default:
        throw ParseException.expectedDirectiveName(nameToken.span().start());
    }
    advance();
    directive.setNameSpan(nameToken.span()).setLeadingWhitespace(nameToken.leadingWhitespace());

    ImmutableList.Builder<Argument> args = ImmutableList.builder();
    while (true) {
      String gap = collectGap();
      Token token = current();
      switch (token.kind()) {
        case IDENT:
        case ARGUMENT:
          advance();
          args.add(argument(Argument.Kind.LITERAL, token, gap));
          break;
        case DOUBLE_QUOTED_STRING:
          advance();
          args.add(argument(Argument.Kind.QUOTED_STRING, token, gap));
          break;
        case SINGLE_QUOTED_STRING:
          advance();
          args.add(argument(Argument.Kind.SINGLE_QUOTED_STRING, token, gap));
          break;
        case VARIABLE:
          advance();
          args.add(argument(Argument.Kind.VARIABLE, token, gap));
          break;
        case SEMICOLON:
          advance();
          directive
              .setArgs(args.build())
              .setSpaceBeforeTerminator(gap)
              .setSpan(Span.create(nameToken.span().start(), token.span().end()));
          finishSimpleDirective(directive);
          return directive.build();
        case OPEN_BRACE:
          advance();
          directive.setArgs(args.build()).setSpaceBeforeTerminator(gap);
          finishBlockDirective(directive, nameToken, token);
          return directive.build();
        case EOF:
          throw ParseException.unexpectedEof(token.span().start());
        case CLOSE_BRACE:
          throw ParseException.missingSemicolon(token.span().start());
        default:
          throw ParseException.unexpectedToken(
              "argument, ';', or '{'", token.kind().displayName(), token.span().start());
      }
    }
  }

  // Everything between two tokens of one directive, which may span lines and comments.
  private String collectGap() {
    StringBuilder gap = new StringBuilder();
    while (current().is(TokenKind.NEWLINE) || current().is(TokenKind.COMMENT)) {
      Token skipped = advance();
      gap.append(skipped.leadingWhitespace()).append(skipped.raw());
    }
    return gap.append(current().leadingWhitespace()).toString();
  }

  private static Argument argument(Argument.Kind kind, Token token, String leadingWhitespace) {
    return Argument.create(kind, token.value(), token.raw(), token.span(), leadingWhitespace);
  }

  private void finishSimpleDirective(Directive.Builder directive) {
    Optional<Comment> trailingComment = parseTrailingComment();
    LineEnd end = finishLine();
    if (trailingComment.isPresent()) {
      directive.setTrailingComment(withTrailingWhitespace(trailingComment.get(), end));
    } else {
      directive.setTrailingWhitespace(end.whitespace);
    }
    directive.setLineBreak(end.lineBreak);
  }

  private void finishBlockDirective(Directive.Builder directive, Token nameToken, Token openBrace)
      throws ParseException {
    String name = nameToken.value();
    LineEnd afterOpen = finishLine();
    directive.setTrailingWhitespace(afterOpen.whitespace).setLineBreak(afterOpen.lineBreak);

    Block.Builder block = Block.builder();
    Token closeBrace;
    if (isRawBlockDirective(name)) {
      closeBrace = readRawBody(block, openBrace);
    } else {
      StringBuilder leading = new StringBuilder();
      block.setItems(parseItems(true, leading)).setLeadingWhitespace(leading.toString());
      if (!current().is(TokenKind.CLOSE_BRACE)) {
        throw ParseException.unclosedBlock(openBrace.span().start());
      }
      closeBrace = advance();
      block.setClosingBraceLeadingWhitespace(closeBrace.leadingWhitespace());
    }
    block.setSpan(Span.create(openBrace.span().start(), closeBrace.span().end()));
    directive.setSpan(Span.create(nameToken.span().start(), closeBrace.span().end()));

    Optional<Comment> trailingComment = parseTrailingComment();
    LineEnd afterClose = finishLine();
    if (trailingComment.isPresent()) {
      directive.setTrailingComment(withTrailingWhitespace(trailingComment.get(), afterClose));
    } else {
      block.setTrailingWhitespace(afterClose.whitespace);
    }
    Block built = block.setLineBreak(afterClose.lineBreak).build();
    directive.setBlock(built);
    if (built.isRaw()) {
      logger.debug("Captured raw block for '{}' at {}", name, openBrace.span().start());
    }
  }

  // Captures the body up to the '}' that balances the opening brace, both verbatim and with
  // single spaces between the tokens of each line.
  private Token readRawBody(Block.Builder block, Token openBrace) throws ParseException {
    StringBuilder verbatim = new StringBuilder();
    StringBuilder normalized = new StringBuilder();
    int depth = 1;
    while (true) {
      Token token = advance();
      switch (token.kind()) {
        case EOF:
          throw ParseException.unclosedBlock(openBrace.span().start());
        case OPEN_BRACE:
          depth++;
          break;
        case CLOSE_BRACE:
          depth--;
          break;
        default:
          break;
      }
      verbatim.append(token.leadingWhitespace());
      if (depth == 0) {
        splitRawBody(verbatim.toString(), normalized.toString(), block);
        return token;
      }
      verbatim.append(token.raw());
      appendNormalized(normalized, token, current());
    }
  }

  // No space after a brace, and none before a line end, ';' or '}'.
  private static void appendNormalized(StringBuilder out, Token token, Token next) {
    switch (token.kind()) {
      case NEWLINE:
        out.append('\n');
        return;
      case OPEN_BRACE:
      case CLOSE_BRACE:
        out.append(token.raw());
        return;
      default:
        out.append(token.raw());
        if (!next.is(TokenKind.NEWLINE)
            && !next.is(TokenKind.EOF)
            && !next.is(TokenKind.CLOSE_BRACE)
            && !next.is(TokenKind.SEMICOLON)) {
          out.append(' ');
        }
    }
  }

  private static void splitRawBody(String body, String normalized, Block.Builder block) {
    CharMatcher whitespace = CharMatcher.whitespace();
    String content = whitespace.trimFrom(normalized);
    block.setRawContent(content);
    int start = whitespace.negate().indexIn(body);
    if (start < 0) {
      block.setLeadingWhitespace(body).setClosingBraceLeadingWhitespace("");
      return;
    }
    int end = whitespace.negate().lastIndexIn(body) + 1;
    String source = body.substring(start, end);
    if (!source.equals(content)) {
      block.setRawSource(source);
    }
    block
        .setLeadingWhitespace(body.substring(0, start))
        .setClosingBraceLeadingWhitespace(body.substring(end));
  }

  private Optional<Comment> parseTrailingComment() {
    if (!current().is(TokenKind.COMMENT)) return Optional.empty();
    Token token = advance();
    return Optional.of(
        Comment.create(token.raw(), token.span(), token.leadingWhitespace(), "", false));
  }

  private static Comment withTrailingWhitespace(Comment comment, LineEnd end) {
    return Comment.create(
        comment.text(), comment.span(), comment.leadingWhitespace(), end.whitespace, false);
  }
}
