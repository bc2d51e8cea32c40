package com.blogflow.backend.capability;

import com.blogflow.backend.capability.model.PublishRequest;
import com.blogflow.backend.capability.model.PublishedPost;

public interface BlogPublisher {

  PublishedPost publish(PublishRequest request);
}
