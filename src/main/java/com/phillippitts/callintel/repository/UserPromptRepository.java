package com.phillippitts.callintel.repository;

import com.phillippitts.callintel.domain.PromptOverrides;

/**
 * Looks up a user's custom prompt-template ids.
 */
public interface UserPromptRepository {

    /**
     * @return the user's overrides; {@link PromptOverrides#none()} for unknown users
     */
    PromptOverrides findPromptOverrides(String userId);
}
