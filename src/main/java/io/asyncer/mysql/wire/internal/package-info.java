/*
 * Copyright 2024 asyncer.io projects
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

/**
 * This package is for internal usage only within the mysql-wire-codec project. It contains the argument
 * checks and buffer utilities that support {@link io.asyncer.mysql.wire.codec.BinaryCodec}.
 * <p>
 * <strong>Important Note:</strong> The contents of this package are subject to change
 * frequently, even with minor or patch version updates.
 */
@NotNullByDefault
package io.asyncer.mysql.wire.internal;

import org.jetbrains.annotations.NotNullByDefault;
