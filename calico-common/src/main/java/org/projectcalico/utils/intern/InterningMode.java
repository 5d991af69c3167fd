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

package org.projectcalico.utils.intern;

import org.projectcalico.annotation.PublicEvolving;

/**
 * The strategy used to canonicalize strings that repeat across many values.
 *
 * @since 0.1
 */
@PublicEvolving
public enum InterningMode {

    /** Canonical instances are kept for the lifetime of the interner. */
    STRONG,

    /** Canonical instances are weakly referenced and released once no value refers to them. */
    WEAK,

    /** Strings are used as given, equal strings may have separate backing storage. */
    NONE
}
