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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Turns the credential a client presents during its handshake into a {@link Principal}.
 * <p>
 * Implementations should be threadsafe.
 */
@FunctionalInterface
public interface PrincipalResolver {
	/**
	 * Resolves a principal for the given credential.
	 *
	 * @param credential the credential from the handshake, or {@code null} if the client supplied none
	 * @return the principal, or {@link Optional#empty()} if the connection is anonymous
	 * @throws PrincipalResolutionException if a credential was supplied but could not be verified
	 */
	@NonNull
	Optional<Principal> resolvePrincipal(@Nullable String credential) throws PrincipalResolutionException;

	/**
	 * Acquires a resolver which treats every connection as anonymous.
	 *
	 * @return an anonymous-only {@code PrincipalResolver}
	 */
	@NonNull
	static PrincipalResolver anonymousOnly() {
		return (credential) -> Optional.empty();
	}

	/**
	 * Acquires a resolver which verifies HS256-signed JSON Web Tokens with the given shared secret.
	 *
	 * @param secret the HMAC secret
	 * @return a JWT-verifying {@code PrincipalResolver}
	 */
	@NonNull
	static PrincipalResolver withHmacSecret(@NonNull String secret) {
		requireNonNull(secret);
		return DefaultPrincipalResolver.withHmacSecret(secret);
	}
}
