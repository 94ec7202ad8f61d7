/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.phonepe.cosign.session;

import lombok.Value;

/**
 * One participant as handed to a session: a session scoped name plus wherever its identity comes from
 */
@Value
public class AgentDefinition {
    String name;

    /**
     * Passed verbatim to the configured {@link com.phonepe.cosign.core.crypto.IdentityLoader}
     */
    String identitySource;

    public static AgentDefinition of(String name, String identitySource) {
        return new AgentDefinition(name, identitySource);
    }
}
