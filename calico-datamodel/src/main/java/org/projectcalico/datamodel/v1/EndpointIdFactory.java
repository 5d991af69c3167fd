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
import org.projectcalico.annotation.VisibleForTesting;
import org.projectcalico.config.Configuration;
import org.projectcalico.datamodel.config.DataModelConfig;
import org.projectcalico.utils.intern.InterningMode;
import org.projectcalico.utils.intern.StringInterner;
import org.projectcalico.utils.intern.StringInterners;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;

import static org.projectcalico.utils.Preconditions.checkNotNull;

/**
 * Creates {@link EndpointId}s whose components are canonicalized through a {@link
 * StringInterner}. A factory is meant to be shared by all the threads decoding keys of one
 * process, for instance the threads handling the events of an etcd watch.
 *
 * @since 0.1
 */
@PublicEvolving
@ThreadSafe
public final class EndpointIdFactory {

    private static final Logger LOG = LoggerFactory.getLogger(EndpointIdFactory.class);

    private static final EndpointIdFactory WITHOUT_INTERNING =
            new EndpointIdFactory(StringInterners.noOp());

    private final StringInterner interner;

    public EndpointIdFactory(StringInterner interner) {
        this.interner = checkNotNull(interner);
    }

    /** Creates a factory with the interning mode configured in the given configuration. */
    public static EndpointIdFactory fromConfiguration(Configuration configuration) {
        InterningMode mode = new DataModelConfig(configuration).getEndpointIdInterningMode();
        LOG.info("Creating endpoint id factory with {} string interning.", mode);
        return new EndpointIdFactory(StringInterners.forMode(mode));
    }

    /** Returns a factory that uses the components as they are given. */
    public static EndpointIdFactory withoutInterning() {
        return WITHOUT_INTERNING;
    }

    public EndpointId create(String host, String orchestrator, String workload, String endpoint) {
        return new EndpointId(
                interner.intern(host),
                interner.intern(orchestrator),
                interner.intern(workload),
                interner.intern(endpoint));
    }

    /** Returns an id equal to the given one whose components are canonicalized. */
    public EndpointId canonicalize(EndpointId endpointId) {
        return create(
                endpointId.getHost(),
                endpointId.getOrchestrator(),
                endpointId.getWorkload(),
                endpointId.getEndpoint());
    }

    @VisibleForTesting
    StringInterner getInterner() {
        return interner;
    }
}
