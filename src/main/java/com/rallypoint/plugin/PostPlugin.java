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
import com.rallypoint.BusinessEvent;
import com.rallypoint.BusinessEventHandler;
import com.rallypoint.InboundEvent;
import com.rallypoint.Plugin;
import com.rallypoint.PluginConnection;
import com.rallypoint.Principal;
import com.rallypoint.RealtimeHub;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Live updates for posts.
 * <p>
 * Clients follow a post by joining its {@code post:<id>} room via {@code subscribeToPost}.  Typing indicators from
 * named, authenticated users are relayed to everyone else in that room.  The {@code post.created}, {@code post.updated}
 * and {@code post.deleted} business events are announced in the default room and, except for creation, in the post's
 * own room.
 */
@ThreadSafe
public final class PostPlugin implements Plugin {
	@NonNull
	public static final String NAME;
	@NonNull
	public static final String POST_CREATED_BUSINESS_EVENT;
	@NonNull
	public static final String POST_UPDATED_BUSINESS_EVENT;
	@NonNull
	public static final String POST_DELETED_BUSINESS_EVENT;
	@NonNull
	private static final Logger LOGGER;

	static {
		NAME = "post";
		POST_CREATED_BUSINESS_EVENT = "post.created";
		POST_UPDATED_BUSINESS_EVENT = "post.updated";
		POST_DELETED_BUSINESS_EVENT = "post.deleted";
		LOGGER = LoggerFactory.getLogger(PostPlugin.class);
	}

	@NonNull
	private final String announcementRoomId;

	public PostPlugin() {
		this(RealtimeHub.DEFAULT_ROOM_ID);
	}

	/**
	 * @param announcementRoomId room that receives post creation, update and deletion announcements
	 */
	public PostPlugin(@NonNull String announcementRoomId) {
		requireNonNull(announcementRoomId);
		this.announcementRoomId = announcementRoomId;
	}

	/**
	 * The room a post's followers join.
	 *
	 * @param postId the post identifier
	 * @return the room identifier, {@code post:<postId>}
	 */
	@NonNull
	public static String roomIdForPost(@NonNull Long postId) {
		requireNonNull(postId);
		return format("post:%d", postId);
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
		return Set.of("subscribeToPost", "unsubscribeFromPost", "typing");
	}

	@NonNull
	@Override
	public Set<@NonNull String> getOutboundEventNames() {
		return Set.of("postCreated", "postUpdated", "postDeleted", "typing");
	}

	@Override
	public void setupEventHandlers(@NonNull PluginConnection pluginConnection,
																 @NonNull Broadcaster broadcaster) {
		requireNonNull(pluginConnection);
		requireNonNull(broadcaster);

		pluginConnection.on("subscribeToPost", (inboundEvent) -> postId(inboundEvent).ifPresent(postId -> {
			broadcaster.joinRoom(pluginConnection.getId(), roomIdForPost(postId));
			LOGGER.debug("Connection {} subscribed to post {}", pluginConnection.getId(), postId);
		}));

		pluginConnection.on("unsubscribeFromPost", (inboundEvent) -> postId(inboundEvent).ifPresent(postId -> {
			broadcaster.leaveRoom(pluginConnection.getId(), roomIdForPost(postId));
			LOGGER.debug("Connection {} unsubscribed from post {}", pluginConnection.getId(), postId);
		}));

		pluginConnection.on("typing", (inboundEvent) -> handleTyping(pluginConnection, broadcaster, inboundEvent));
	}

	@NonNull
	@Override
	public Optional<BusinessEventHandler> getBusinessEventHandler() {
		return Optional.of(this::handleBusinessEvent);
	}

	protected void handleTyping(@NonNull PluginConnection pluginConnection,
															@NonNull Broadcaster broadcaster,
															@NonNull InboundEvent inboundEvent) {
		requireNonNull(pluginConnection);
		requireNonNull(broadcaster);
		requireNonNull(inboundEvent);

		Principal principal = pluginConnection.getPrincipal().orElse(null);

		// Anonymous and unnamed users stay silent
		if (principal == null || principal.getName().isEmpty())
			return;

		Long postId = inboundEvent.getLong("postId").orElse(null);

		if (postId == null)
			return;

		Map<String, Object> payload = new LinkedHashMap<>(4);
		payload.put("postId", postId);
		payload.put("isTyping", inboundEvent.getBoolean("isTyping").orElse(false));
		payload.put("userId", principal.getUserId());
		payload.put("userName", principal.getName().get());

		broadcaster.broadcastToRoomExcept(roomIdForPost(postId), pluginConnection.getId(), "typing", payload);
	}

	protected void handleBusinessEvent(@NonNull BusinessEvent businessEvent,
																		 @NonNull Broadcaster broadcaster) {
		requireNonNull(businessEvent);
		requireNonNull(broadcaster);

		String type = businessEvent.getType();

		if (!POST_CREATED_BUSINESS_EVENT.equals(type) && !POST_UPDATED_BUSINESS_EVENT.equals(type) && !POST_DELETED_BUSINESS_EVENT.equals(type))
			return;

		Map<String, Object> post = businessEvent.getPayload();
		Object author = post.get("authorName");
		Long postId = asPostId(post.get("postId"));

		Map<String, Object> payload = new LinkedHashMap<>(2);

		if (POST_DELETED_BUSINESS_EVENT.equals(type))
			payload.put("postId", post.get("postId"));
		else
			payload.put("post", post);

		payload.put("author", author);

		String event = POST_CREATED_BUSINESS_EVENT.equals(type) ? "postCreated"
				: POST_UPDATED_BUSINESS_EVENT.equals(type) ? "postUpdated" : "postDeleted";

		broadcaster.broadcastToRoom(getAnnouncementRoomId(), event, payload);

		if (!POST_CREATED_BUSINESS_EVENT.equals(type) && postId != null)
			broadcaster.broadcastToRoom(roomIdForPost(postId), event, payload);

		LOGGER.debug("Announced {} for post {}", event, postId);
	}

	@NonNull
	private static Optional<Long> postId(@NonNull InboundEvent inboundEvent) {
		requireNonNull(inboundEvent);

		Optional<Long> postId = inboundEvent.getPayloadAsLong();
		return postId.isPresent() ? postId : inboundEvent.getLong("postId");
	}

	@Nullable
	private static Long asPostId(@Nullable Object value) {
		if (value instanceof Number number)
			return number.longValue();

		if (value instanceof String string) {
			try {
				return Long.valueOf(string.trim());
			} catch (NumberFormatException ignored) {
				return null;
			}
		}

		return null;
	}

	@NonNull
	private String getAnnouncementRoomId() {
		return this.announcementRoomId;
	}
}
