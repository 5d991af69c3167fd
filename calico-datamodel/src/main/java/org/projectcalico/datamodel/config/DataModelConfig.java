/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.projectcalico.datamodel.config;

import org.projectcalico.annotation.PublicEvolving;
import org.projectcalico.config.Configuration;
import org.projectcalico.utils.intern.InterningMode;

import static org.projectcalico.utils.Preconditions.checkNotNull;

/**
 * Helper class to get the data model configs (prefixed with "datamodel.*" properties).
 *
 * @since 0.1
 */
@PublicEvolving
public class DataModelConfig {

    private final Configuration config;

    public DataModelConfig(Configuration config) {
        this.config = checkNotNull(config);
    }

    /** Gets how the components of endpoint ids are canonicalized. */
    public InterningMode getEndpointIdInterningMode() {
        return config.get(DataModelConfigOptions.ENDPOINT_ID_INTERNING);
    }
}
