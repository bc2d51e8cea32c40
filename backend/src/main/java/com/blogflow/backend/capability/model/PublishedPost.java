package com.blogflow.backend.capability.model;

import java.util.Objects;

/** Where the post ended up. {@code locator} is the public URL shown to the user. */
public record PublishedPost(String locator, String entryId, boolean draft) {

  public PublishedPost {
    Objects.requireNonNull(locator, "locator");
  }
}
