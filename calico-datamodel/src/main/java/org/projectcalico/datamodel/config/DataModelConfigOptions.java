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
import org.projectcalico.config.ConfigOption;
import org.projectcalico.config.ConfigOptions;
import org.projectcalico.utils.intern.InterningMode;

/**
 * Config options of the data model (prefixed with "datamodel.").
 *
 * @since 0.1
 */
@PublicEvolving
public class DataModelConfigOptions {

    public static final ConfigOption<InterningMode> ENDPOINT_ID_INTERNING =
            ConfigOptions.key("datamodel.endpoint-id.interning")
                    .enumType(InterningMode.class)
                    .defaultValue(InterningMode.WEAK)
                    .withDescription(
                            "How the components of endpoint ids are canonicalized. "
                                    + "STRONG keeps every distinct string for the lifetime of "
                                    + "the process, WEAK releases the strings that are no longer "
                                    + "referenced and NONE disables interning.");

    private DataModelConfigOptions() {}
}
