package ngxlint.lint;

import java.util.List;

/** A check over raw text, run before parsing so it can report files the parser rejects. */
public interface SourceCheck {
  String name();

  String category();

  List<LintError> check(String source);
}
