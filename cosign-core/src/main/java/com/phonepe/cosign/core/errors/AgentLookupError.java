package com.phonepe.cosign.core.errors;

import java.util.Collection;

/**
 * Agent or peer name not registered in the session
 */
public class AgentLookupError extends CosignError {
    public AgentLookupError(final String name, final Collection<String> available) {
        super(ErrorType.AGENT_LOOKUP, null, name, available);
    }
}
