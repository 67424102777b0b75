package io.upreview.backend.recipient;

public enum Sentiment {
  UNREVIEWED,
  GOOD,
  BAD
}
