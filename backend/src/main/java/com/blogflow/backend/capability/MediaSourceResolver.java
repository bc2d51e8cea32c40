package com.blogflow.backend.capability;

/**
 * Turns a channel-specific media reference (the payload of a media unit) into a URL the service
 * can download from. Plain http(s) payloads need no resolver.
 */
public interface MediaSourceResolver {

  boolean supports(String payload);

  String downloadUrl(String payload);
}
