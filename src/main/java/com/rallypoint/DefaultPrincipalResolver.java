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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;

import static com.rallypoint.Utilities.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@link PrincipalResolver} which verifies compact HS256 JSON Web Tokens.
 * <p>
 * Recognized claims are {@code userId} (required, numeric), {@code role}, {@code name} and {@code exp}.
 * A {@code "Bearer "} prefix on the credential is tolerated.
 */
@ThreadSafe
final class DefaultPrincipalResolver implements PrincipalResolver {
	@NonNull
	private static final String HMAC_ALGORITHM;
	@NonNull
	private static final String BEARER_PREFIX;
	@NonNull
	private static final TypeReference<Map<String, Object>> CLAIMS_TYPE_REFERENCE;

	static {
		HMAC_ALGORITHM = "HmacSHA256";
		BEARER_PREFIX = "Bearer ";
		CLAIMS_TYPE_REFERENCE = new TypeReference<>() {};
	}

	@NonNull
	private final SecretKeySpec secretKeySpec;
	@NonNull
	private final Clock clock;
	@NonNull
	private final ObjectMapper objectMapper;

	@NonNull
	static DefaultPrincipalResolver withHmacSecret(@NonNull String secret) {
		return new DefaultPrincipalResolver(secret, Clock.systemUTC());
	}

	@NonNull
	static DefaultPrincipalResolver withHmacSecret(@NonNull String secret,
																								 @NonNull Clock clock) {
		return new DefaultPrincipalResolver(secret, clock);
	}

	private DefaultPrincipalResolver(@NonNull String secret,
																	 @NonNull Clock clock) {
		requireNonNull(secret);
		requireNonNull(clock);

		if (secret.isEmpty())
			throw new IllegalArgumentException("HMAC secret must not be empty");

		this.secretKeySpec = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
		this.clock = clock;
		this.objectMapper = new ObjectMapper();
	}

	@NonNull
	@Override
	public Optional<Principal> resolvePrincipal(@Nullable String credential) throws PrincipalResolutionException {
		String token = trimAggressivelyToNull(credential);

		if (token == null)
			return Optional.empty();

		if (token.startsWith(BEARER_PREFIX))
			token = trimAggressivelyToNull(token.substring(BEARER_PREFIX.length()));

		if (token == null)
			return Optional.empty();

		String[] components = token.split("\\.", -1);

		if (components.length != 3)
			throw new PrincipalResolutionException("Token is not a compact JWT");

		Map<String, Object> header = decodeJson(components[0]);

		if (!"HS256".equals(header.get("alg")))
			throw new PrincipalResolutionException(format("Unsupported JWT algorithm '%s'", header.get("alg")));

		byte[] expectedSignature = sign(format("%s.%s", components[0], components[1]));
		byte[] actualSignature;

		try {
			actualSignature = Base64.getUrlDecoder().decode(components[2]);
		} catch (IllegalArgumentException e) {
			throw new PrincipalResolutionException("JWT signature is not valid base64url", e);
		}

		if (!MessageDigest.isEqual(expectedSignature, actualSignature))
			throw new PrincipalResolutionException("JWT signature does not match");

		Map<String, Object> claims = decodeJson(components[1]);

		Object expiration = claims.get("exp");

		if (expiration != null) {
			if (!(expiration instanceof Number expirationAsNumber))
				throw new PrincipalResolutionException("JWT 'exp' claim is not numeric");

			if (getClock().instant().getEpochSecond() >= expirationAsNumber.longValue())
				throw new PrincipalResolutionException("JWT has expired");
		}

		Object userId = claims.get("userId");
		Long userIdAsLong;

		if (userId instanceof Number userIdAsNumber) {
			userIdAsLong = userIdAsNumber.longValue();
		} else if (userId instanceof String userIdAsString) {
			try {
				userIdAsLong = Long.valueOf(userIdAsString.trim());
			} catch (NumberFormatException e) {
				throw new PrincipalResolutionException("JWT 'userId' claim is not numeric", e);
			}
		} else {
			throw new PrincipalResolutionException("JWT is missing its 'userId' claim");
		}

		Object role = claims.get("role");
		Object name = claims.get("name");

		return Optional.of(Principal.withUserId(userIdAsLong)
				.role(role == null ? null : role.toString())
				.name(name == null ? null : name.toString())
				.build());
	}

	@NonNull
	private Map<String, Object> decodeJson(@NonNull String base64UrlComponent) throws PrincipalResolutionException {
		requireNonNull(base64UrlComponent);

		try {
			byte[] json = Base64.getUrlDecoder().decode(base64UrlComponent);
			Map<String, Object> decoded = getObjectMapper().readValue(json, CLAIMS_TYPE_REFERENCE);

			if (decoded == null)
				throw new PrincipalResolutionException("JWT component is not a JSON object");

			return decoded;
		} catch (IllegalArgumentException | IOException e) {
			throw new PrincipalResolutionException("JWT component could not be decoded", e);
		}
	}

	@NonNull
	private byte[] sign(@NonNull String signingInput) throws PrincipalResolutionException {
		requireNonNull(signingInput);

		try {
			Mac mac = Mac.getInstance(HMAC_ALGORITHM);
			mac.init(getSecretKeySpec());
			return mac.doFinal(signingInput.getBytes(StandardCharsets.US_ASCII));
		} catch (GeneralSecurityException e) {
			throw new PrincipalResolutionException("Unable to compute JWT signature", e);
		}
	}

	@NonNull
	private SecretKeySpec getSecretKeySpec() {
		return this.secretKeySpec;
	}

	@NonNull
	private Clock getClock() {
		return this.clock;
	}

	@NonNull
	private ObjectMapper getObjectMapper() {
		return this.objectMapper;
	}
}
