package io.upreview.backend.invitation;

/** Display name and address used in the {@code From} header of invitation emails. */
public record SenderAddress(String name, String address) {

  public String header() {
    return "\"" + name.replace("\"", "") + "\" <" + address + ">";
  }
}
