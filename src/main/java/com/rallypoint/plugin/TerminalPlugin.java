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

package com.rallypoint.plugin;

import com.rallypoint.Broadcaster;
import com.rallypoint.InboundEvent;
import com.rallypoint.Plugin;
import com.rallypoint.PluginConnection;
import com.rallypoint.Principal;
import com.rallypoint.terminal.TerminalCreateOptions;
import com.rallypoint.terminal.TerminalInfo;
import com.rallypoint.terminal.TerminalManager;
import com.rallypoint.terminal.TerminalOutputListener;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Exposes {@link TerminalManager} to clients.
 * <p>
 * Output of a session is streamed as {@code terminalData} to the connection that created it.  Input, resize and
 * destroy requests for a session owned by another user are refused with {@code terminalError} unless the caller is an
 * admin.  Sessions created anonymously have no owner and can be driven by anyone who knows the identifier.
 */
@ThreadSafe
public final class TerminalPlugin implements Plugin {
	@NonNull
	public static final String NAME;
	@NonNull
	public static final String TERMINAL_CREATED_EVENT;
	@NonNull
	public static final String TERMINAL_DATA_EVENT;
	@NonNull
	public static final String TERMINAL_DESTROYED_EVENT;
	@NonNull
	public static final String TERMINAL_ERROR_EVENT;
	@NonNull
	public static final String TERMINAL_LIST_EVENT;

	static {
		NAME = "terminal";
		TERMINAL_CREATED_EVENT = "terminalCreated";
		TERMINAL_DATA_EVENT = "terminalData";
		TERMINAL_DESTROYED_EVENT = "terminalDestroyed";
		TERMINAL_ERROR_EVENT = "terminalError";
		TERMINAL_LIST_EVENT = "terminalList";
	}

	@NonNull
	private final TerminalManager terminalManager;

	public TerminalPlugin(@NonNull TerminalManager terminalManager) {
		requireNonNull(terminalManager);
		this.terminalManager = terminalManager;
	}

	@NonNull
	@Override
	public String getName() {
		return NAME;
	}

	@NonNull
	@Override
	public String getVersion() {
		return "1.0.0";
	}

	@NonNull
	@Override
	public Set<@NonNull String> getInboundEventNames() {
		return Set.of("terminalCreate", "terminalInput", "terminalResize", "terminalDestroy", "terminalList");
	}

	@NonNull
	@Override
	public Set<@NonNull String> getOutboundEventNames() {
		return Set.of(TERMINAL_CREATED_EVENT, TERMINAL_DATA_EVENT, TERMINAL_DESTROYED_EVENT, TERMINAL_ERROR_EVENT, TERMINAL_LIST_EVENT);
	}

	@Override
	public void setupEventHandlers(@NonNull PluginConnection pluginConnection,
																 @NonNull Broadcaster broadcaster) {
		requireNonNull(pluginConnection);
		requireNonNull(broadcaster);

		pluginConnection.on("terminalCreate", (inboundEvent) -> handleCreate(pluginConnection, broadcaster, inboundEvent));
		pluginConnection.on("terminalInput", (inboundEvent) -> handleInput(pluginConnection, inboundEvent));
		pluginConnection.on("terminalResize", (inboundEvent) -> handleResize(pluginConnection, inboundEvent));
		pluginConnection.on("terminalDestroy", (inboundEvent) -> handleDestroy(pluginConnection, inboundEvent));
		pluginConnection.on("terminalList", (inboundEvent) -> handleList(pluginConnection));
	}

	@Override
	public void cleanup() {
		getTerminalManager().destroyAll();
	}

	protected void handleCreate(@NonNull PluginConnection pluginConnection,
															@NonNull Broadcaster broadcaster,
															@NonNull InboundEvent inboundEvent) {
		requireNonNull(pluginConnection);
		requireNonNull(broadcaster);
		requireNonNull(inboundEvent);

		String connectionId = pluginConnection.getId();
		Principal principal = pluginConnection.getPrincipal().orElse(null);

		TerminalOutputListener outputListener = new TerminalOutputListener() {
			@Override
			public void didReceiveOutput(@NonNull String terminalId,
																	 @NonNull String data) {
				broadcaster.broadcastToConnection(connectionId, TERMINAL_DATA_EVENT, terminalDataPayload(terminalId, data));
			}

			@Override
			public void didExit(@NonNull String terminalId,
													@NonNull Integer exitCode) {
				broadcaster.broadcastToConnection(connectionId, TERMINAL_DESTROYED_EVENT, terminalIdPayload(terminalId));
			}
		};

		TerminalCreateOptions terminalCreateOptions;

		try {
			terminalCreateOptions = TerminalCreateOptions.withDefaults()
					.columns(inboundEvent.getInteger("cols").orElse(null))
					.rows(inboundEvent.getInteger("rows").orElse(null))
					.shell(inboundEvent.getString("shell").orElse(null))
					.ownerUserId(principal == null ? null : principal.getUserId())
					.ownerName(principal == null ? null : principal.getName().orElse(null))
					.outputListener(outputListener)
					.build();
		} catch (IllegalArgumentException e) {
			pluginConnection.emit(TERMINAL_ERROR_EVENT, terminalErrorPayload(null, e.getMessage()));
			return;
		}

		TerminalInfo terminalInfo = getTerminalManager().create(terminalCreateOptions);

		Map<String, Object> createdPayload = new LinkedHashMap<>(3);
		createdPayload.put("terminalId", terminalInfo.getId());
		createdPayload.put("cols", terminalInfo.getColumns());
		createdPayload.put("rows", terminalInfo.getRows());
		pluginConnection.emit(TERMINAL_CREATED_EVENT, createdPayload);

		getTerminalManager().welcomeMessage(terminalInfo.getId()).ifPresent(welcomeMessage ->
				pluginConnection.emit(TERMINAL_DATA_EVENT, terminalDataPayload(terminalInfo.getId(), welcomeMessage)));
	}

	protected void handleInput(@NonNull PluginConnection pluginConnection,
														 @NonNull InboundEvent inboundEvent) {
		requireNonNull(pluginConnection);
		requireNonNull(inboundEvent);

		TerminalInfo terminalInfo = authorizedTerminal(pluginConnection, inboundEvent.getString("terminalId").orElse(null)).orElse(null);

		if (terminalInfo == null)
			return;

		// Raw input, so whitespace-only keystrokes must survive
		Object input = inboundEvent.getPayload()
				.filter(payload -> payload instanceof Map<?, ?>)
				.map(payload -> ((Map<?, ?>) payload).get("input"))
				.orElse(null);

		if (!(input instanceof String inputAsString)) {
			pluginConnection.emit(TERMINAL_ERROR_EVENT, terminalErrorPayload(terminalInfo.getId(), "Input must be a string"));
			return;
		}

		if (!getTerminalManager().write(terminalInfo.getId(), inputAsString))
			pluginConnection.emit(TERMINAL_ERROR_EVENT, terminalErrorPayload(terminalInfo.getId(), "Unable to write to terminal"));
	}

	protected void handleResize(@NonNull PluginConnection pluginConnection,
															@NonNull InboundEvent inboundEvent) {
		requireNonNull(pluginConnection);
		requireNonNull(inboundEvent);

		TerminalInfo terminalInfo = authorizedTerminal(pluginConnection, inboundEvent.getString("terminalId").orElse(null)).orElse(null);

		if (terminalInfo == null)
			return;

		Integer columns = inboundEvent.getInteger("cols").orElse(null);
		Integer rows = inboundEvent.getInteger("rows").orElse(null);

		if (columns == null || rows == null || !getTerminalManager().resize(terminalInfo.getId(), columns, rows))
			pluginConnection.emit(TERMINAL_ERROR_EVENT, terminalErrorPayload(terminalInfo.getId(), "Invalid terminal size"));
	}

	protected void handleDestroy(@NonNull PluginConnection pluginConnection,
															 @NonNull InboundEvent inboundEvent) {
		requireNonNull(pluginConnection);
		requireNonNull(inboundEvent);

		// Either a bare identifier or {"terminalId": "..."}
		String terminalId = inboundEvent.getPayloadAsString().orElse(inboundEvent.getString("terminalId").orElse(null));
		TerminalInfo terminalInfo = authorizedTerminal(pluginConnection, terminalId).orElse(null);

		if (terminalInfo == null)
			return;

		if (getTerminalManager().destroy(terminalInfo.getId()))
			pluginConnection.emit(TERMINAL_DESTROYED_EVENT, terminalIdPayload(terminalInfo.getId()));
	}

	protected void handleList(@NonNull PluginConnection pluginConnection) {
		requireNonNull(pluginConnection);

		Principal principal = pluginConnection.getPrincipal().orElse(null);
		List<Map<String, Object>> terminals = new ArrayList<>();

		for (TerminalInfo terminalInfo : getTerminalManager().all())
			if (isVisibleTo(terminalInfo, principal))
				terminals.add(terminalListEntry(terminalInfo));

		Map<String, Object> payload = new LinkedHashMap<>(1);
		payload.put("terminals", terminals);
		pluginConnection.emit(TERMINAL_LIST_EVENT, payload);
	}

	/**
	 * Looks up a session and checks the caller may control it, emitting {@code terminalError} if not.
	 */
	@NonNull
	protected Optional<TerminalInfo> authorizedTerminal(@NonNull PluginConnection pluginConnection,
																											@Nullable String terminalId) {
		requireNonNull(pluginConnection);

		if (terminalId == null) {
			pluginConnection.emit(TERMINAL_ERROR_EVENT, terminalErrorPayload(null, "Terminal ID is required"));
			return Optional.empty();
		}

		TerminalInfo terminalInfo = getTerminalManager().get(terminalId).orElse(null);

		if (terminalInfo == null) {
			pluginConnection.emit(TERMINAL_ERROR_EVENT, terminalErrorPayload(terminalId, "Terminal not found"));
			return Optional.empty();
		}

		if (!isPermitted(terminalInfo, pluginConnection.getPrincipal().orElse(null))) {
			pluginConnection.emit(TERMINAL_ERROR_EVENT, terminalErrorPayload(terminalId, "Access denied"));
			return Optional.empty();
		}

		return Optional.of(terminalInfo);
	}

	@NonNull
	static Boolean isPermitted(@NonNull TerminalInfo terminalInfo,
														 @Nullable Principal principal) {
		requireNonNull(terminalInfo);

		Long ownerUserId = terminalInfo.getOwnerUserId().orElse(null);

		if (ownerUserId == null)
			return true;

		if (principal == null)
			return false;

		return principal.isAdmin() || ownerUserId.equals(principal.getUserId());
	}

	// Admins see everything; everyone else sees their own sessions, anonymous callers see unowned ones
	@NonNull
	static Boolean isVisibleTo(@NonNull TerminalInfo terminalInfo,
														 @Nullable Principal principal) {
		requireNonNull(terminalInfo);

		Long ownerUserId = terminalInfo.getOwnerUserId().orElse(null);

		if (principal == null)
			return ownerUserId == null;

		return principal.isAdmin() || principal.getUserId().equals(ownerUserId);
	}

	@NonNull
	private static Map<String, Object> terminalListEntry(@NonNull TerminalInfo terminalInfo) {
		Map<String, Object> entry = new LinkedHashMap<>(8);
		entry.put("terminalId", terminalInfo.getId());
		entry.put("cols", terminalInfo.getColumns());
		entry.put("rows", terminalInfo.getRows());
		entry.put("shell", terminalInfo.getShell());
		entry.put("status", terminalInfo.getStatus().name().toLowerCase(Locale.ROOT));
		entry.put("simulated", terminalInfo.isSimulated());
		entry.put("createdAt", terminalInfo.getCreatedAt().toString());
		entry.put("lastActivityAt", terminalInfo.getLastActivityAt().toString());
		return entry;
	}

	@NonNull
	private static Map<String, Object> terminalDataPayload(@NonNull String terminalId,
																												 @NonNull String data) {
		Map<String, Object> payload = new LinkedHashMap<>(2);
		payload.put("terminalId", terminalId);
		payload.put("data", data);
		return payload;
	}

	@NonNull
	private static Map<String, Object> terminalIdPayload(@NonNull String terminalId) {
		Map<String, Object> payload = new LinkedHashMap<>(1);
		payload.put("terminalId", terminalId);
		return payload;
	}

	@NonNull
	private static Map<String, Object> terminalErrorPayload(@Nullable String terminalId,
																													@Nullable String error) {
		Map<String, Object> payload = new LinkedHashMap<>(2);
		payload.put("terminalId", terminalId);
		payload.put("error", error);
		return payload;
	}

	@NonNull
	private TerminalManager getTerminalManager() {
		return this.terminalManager;
	}
}
