package ngxlint.lint.rules;

public class AutoindexEnabled extends SwitchedOnRule {

  public static final String NAME = "autoindex-enabled";

  public AutoindexEnabled() {
    super("autoindex");
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public String description() {
    return "Detects when autoindex is enabled (can expose directory contents)";
  }

  @Override
  String message() {
    return "autoindex is enabled, which can expose directory contents";
  }
}
