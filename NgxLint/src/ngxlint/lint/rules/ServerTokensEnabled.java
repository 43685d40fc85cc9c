package ngxlint.lint.rules;

public class ServerTokensEnabled extends SwitchedOnRule {

  public static final String NAME = "server-tokens-enabled";

  public ServerTokensEnabled() {
    super("server_tokens");
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public String description() {
    return "Detects when server_tokens is enabled, exposing the nginx version";
  }

  @Override
  String message() {
    return "server_tokens should be 'off' to hide nginx version";
  }
}
