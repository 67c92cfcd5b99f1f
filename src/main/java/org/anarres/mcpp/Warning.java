/*
 * Anarres C Preprocessor
 * Copyright (c) 2007-2015, Shevek
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.anarres.mcpp;

/**
 * Warning classes which may be optionally emitted by the Preprocessor.
 */
public enum Warning {

    /** An undefined identifier was evaluated as 0 in a conditional. */
    UNDEF,
    /** Extra tokens follow a directive which takes none, or only a name. */
    ENDIF_LABELS,
    /** Warnings are reported as errors. */
    ERROR;
}
