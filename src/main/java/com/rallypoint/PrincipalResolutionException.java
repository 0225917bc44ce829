/*
 * Copyright 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rallypoint;

import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Thrown when a handshake credential was supplied but could not be verified - a bad signature, an expired token,
 * missing claims and so forth.
 */
@NotThreadSafe
public class PrincipalResolutionException extends Exception {
	public PrincipalResolutionException(@Nullable String message) {
		super(message);
	}

	public PrincipalResolutionException(@Nullable String message,
																			@Nullable Throwable cause) {
		super(message, cause);
	}
}
