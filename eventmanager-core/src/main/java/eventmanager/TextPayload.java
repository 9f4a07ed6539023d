package eventmanager;

import java.util.Objects;

/**
 * Payload carrying a single string.
 */
public final class TextPayload implements Payload {

  private final String text;

  private TextPayload(String text) {
    this.text = Objects.requireNonNull(text, "text");
  }

  public static TextPayload of(String text) {
    return new TextPayload(text);
  }

  public String text() {
    return text;
  }

  @Override
  public String render() {
    return text;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof TextPayload)) return false;
    return text.equals(((TextPayload) o).text);
  }

  @Override
  public int hashCode() {
    return text.hashCode();
  }

  @Override
  public String toString() {
    return "TextPayload{" + text + '}';
  }
}
