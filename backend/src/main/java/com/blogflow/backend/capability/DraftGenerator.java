package com.blogflow.backend.capability;

import com.blogflow.backend.capability.model.Draft;
import com.blogflow.backend.capability.model.DraftSeed;

public interface DraftGenerator {

  Draft generate(DraftSeed seed);
}
