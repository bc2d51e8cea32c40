package com.blogflow.backend.capability;

import com.blogflow.backend.capability.model.HostedMedia;
import com.blogflow.backend.ingest.domain.InboundUnit;

/**
 * Hosts one media unit. The engine calls it once per unit so that a partial failure can be
 * degraded or escalated according to the configured policy.
 */
public interface MediaUploader {

  HostedMedia upload(InboundUnit mediaUnit);
}
