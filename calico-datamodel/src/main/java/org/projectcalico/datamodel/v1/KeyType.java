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

package org.projectcalico.datamodel.v1;

import org.projectcalico.annotation.PublicEvolving;

/**
 * The kinds of keys of {@link DataModelV1}, as returned by {@link DataModelV1#classify(String)}.
 *
 * @since 0.1
 */
@PublicEvolving
public enum KeyType {
    READY,
    CONFIG,
    HOST,
    HOST_CONFIG,
    HOST_IP,
    ENDPOINT,
    ENDPOINT_STATUS,
    FELIX_STATUS,
    FELIX_LAST_STATUS,
    PROFILE,
    PROFILE_RULES,
    PROFILE_TAGS,
    IPAM_V4_POOL,
    NEUTRON_ELECTION,

    /** A key of another data model version or of an unrelated sub-tree. */
    UNKNOWN
}
