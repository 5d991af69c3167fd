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

import javax.annotation.concurrent.ThreadSafe;

/**
 * Returns a canonical instance for each distinct string, so that equal strings held by many
 * long-lived values share their storage. Implementations must allow concurrent calls to {@link
 * #intern(String)}.
 *
 * @see StringInterners
 * @since 0.1
 */
@PublicEvolving
@ThreadSafe
public interface StringInterner {

    /**
     * Returns the canonical instance equal to the given string. The first instance seen becomes
     * the canonical one.
     *
     * @throws NullPointerException if {@code value} is null
     */
    String intern(String value);
}
