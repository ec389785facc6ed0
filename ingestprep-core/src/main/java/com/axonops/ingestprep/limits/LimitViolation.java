/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.ingestprep.limits;

/**
 * The first limit a label set breaks.
 *
 * @param kind which limit
 * @param label offending label, or null for {@link ViolationKind#TOO_MANY_LABELS}
 * @param actual label count or length in bytes that broke the limit
 * @param limit configured limit
 * @since 1.0.0
 */
public record LimitViolation(ViolationKind kind, Label label, int actual, int limit) {}
