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

import javax.annotation.Nullable;

/**
 * The status of an endpoint, as reported by Felix under its {@link
 * DataModelV1.EndpointStatusKey}.
 *
 * @since 0.1
 */
@PublicEvolving
public enum EndpointStatus {
    UP("up"),
    DOWN("down"),
    ERROR("error");

    private final String value;

    EndpointStatus(String value) {
        this.value = value;
    }

    /** The value of the status as it is stored in etcd. */
    public String getValue() {
        return value;
    }

    /** Returns the status of the given stored value, ignoring case, or null if it is unknown. */
    @Nullable
    public static EndpointStatus fromValue(String value) {
        for (EndpointStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return value;
    }
}
