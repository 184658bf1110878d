/*
 * Copyright 2024-2024 the original author or authors.
 */
package io.ssemcp.client;

import java.net.URI;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.ssemcp.spec.McpClientListener;
import io.ssemcp.spec.McpClientSession;
import io.ssemcp.spec.McpClientSession.NotificationHandler;
import io.ssemcp.spec.McpClientTransport;
import io.ssemcp.spec.McpConnectionState;
import io.ssemcp.spec.McpError;
import io.ssemcp.spec.McpSchema;
import io.ssemcp.spec.RequestIdGenerator;
import io.ssemcp.util.Assert;
import io.ssemcp.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * 基于推送事件流的MCP客户端，使用Project Reactor的Mono和Flux类型提供与MCP服务器的异步通信。
 *
 * <p>
 * 客户端遵循以下生命周期：
 * <ol>
 * <li>{@link McpConnectionState#DISCONNECTED} - 尚未连接，或者上一次连接失败</li>
 * <li>{@link McpConnectionState#CONNECTING} - 打开事件流，等待一小段时间让服务器公告提交端点，然后握手</li>
 * <li>{@link McpConnectionState#CONNECTED} - 握手成功，可以调用工具和资源相关的操作</li>
 * <li>{@link McpConnectionState#DISPOSED} - 已关闭，终止状态</li>
 * </ol>
 *
 * <p>
 * 握手时如果服务器以包含"invalid request parameters"的错误拒绝首选协议版本，客户端会用
 * {@link McpSchema#LEGACY_PROTOCOL_VERSION}重试一次。
 *
 * @author Dariusz Jędrzejczyk
 * @author Christian Tzolov
 * @see McpClient
 * @see McpClientSession
 */
public class McpAsyncClient {

	private static final Logger logger = LoggerFactory.getLogger(McpAsyncClient.class);

	/** 触发协议版本回退的错误信息片段，不区分大小写 */
	static final String INVALID_PARAMS_MARKER = "invalid request parameters";

	private static final TypeReference<JsonNode> JSON_NODE_TYPE_REF = new TypeReference<>() {
	};

	private static final TypeReference<McpSchema.InitializeResult> INITIALIZE_RESULT_TYPE_REF = new TypeReference<>() {
	};

	private final McpClientSession mcpSession;

	private final McpClientTransport transport;

	private final McpClientOptions options;

	/** 打开事件流之后、发送握手请求之前的等待时间 */
	private final Duration connectGracePeriod;

	private final Scheduler scheduler;

	private final McpClientListener listener;

	private final AtomicReference<McpConnectionState> state = new AtomicReference<>(McpConnectionState.DISCONNECTED);

	/** 最近一次成功握手的结果 */
	private volatile McpSchema.InitializeResult initializeResult;

	/** 最近一次成功握手使用的协议版本 */
	private volatile String protocolVersion;

	McpAsyncClient(McpClientTransport transport, Duration requestTimeout, Duration connectGracePeriod,
			RequestIdGenerator idGenerator, Scheduler scheduler, McpClientListener listener,
			ObjectMapper objectMapper, McpClientFeatures.Async features) {

		Assert.notNull(transport, "Transport must not be null");
		Assert.notNull(requestTimeout, "Request timeout must not be null");
		Assert.notNull(connectGracePeriod, "Connect grace period must not be null");
		Assert.isTrue(!connectGracePeriod.isNegative(), "Connect grace period must not be negative");
		Assert.notNull(scheduler, "Scheduler must not be null");
		Assert.notNull(listener, "Listener must not be null");
		Assert.notNull(features, "Features must not be null");

		this.transport = transport;
		this.options = features.options();
		this.connectGracePeriod = connectGracePeriod;
		this.scheduler = scheduler;
		this.listener = listener;

		// Notification Handlers
		Map<String, NotificationHandler> notificationHandlers = new HashMap<>();

		notificationHandlers.put(McpSchema.METHOD_NOTIFICATION_MESSAGE,
				params -> Mono.fromRunnable(() -> logger.debug("Server log message: {}", params)));

		if (!features.toolsChangeConsumers().isEmpty()) {
			notificationHandlers.put(McpSchema.METHOD_NOTIFICATION_TOOLS_LIST_CHANGED,
					asyncToolsChangeNotificationHandler(features.toolsChangeConsumers()));
		}
		if (!features.resourcesChangeConsumers().isEmpty()) {
			notificationHandlers.put(McpSchema.METHOD_NOTIFICATION_RESOURCES_LIST_CHANGED,
					asyncResourcesChangeNotificationHandler(features.resourcesChangeConsumers()));
		}

		// 显式注册的处理器优先
		notificationHandlers.putAll(features.notificationHandlers());

		this.mcpSession = new McpClientSession(requestTimeout, transport, notificationHandlers, idGenerator, scheduler,
				listener, objectMapper);
	}

	// --------------------------
	// Lifecycle
	// --------------------------

	/**
	 * 打开事件流，等待宽限期后完成握手。只能在{@link McpConnectionState#DISCONNECTED}状态下调用。
	 *
	 * <p>
	 * 失败时取消事件流订阅并回到{@link McpConnectionState#DISCONNECTED}，之后可以再次调用。
	 * @return 发出握手结果的Mono
	 */
	public Mono<McpSchema.InitializeResult> connect() {
		return Mono.defer(() -> {
			McpConnectionState current = this.state.get();
			if (current == McpConnectionState.DISPOSED) {
				return Mono.error(new IllegalStateException(McpClientSession.CLIENT_DISPOSED_MESSAGE));
			}
			if (!transition(McpConnectionState.DISCONNECTED, McpConnectionState.CONNECTING)) {
				return Mono.error(new IllegalStateException("Cannot connect while " + current));
			}

			return this.mcpSession.connect()
				.then(Mono.delay(this.connectGracePeriod, this.scheduler))
				.then(Mono.defer(this::initializeWithFallback))
				.doOnSuccess(result -> {
					if (transition(McpConnectionState.CONNECTING, McpConnectionState.CONNECTED)) {
						logger.info("Connected to {} using protocol {}", this.transport.getSubmissionEndpoint(),
								this.protocolVersion);
					}
				})
				.doOnError(error -> {
					logger.warn("Connect failed: {}", error.getMessage());
					abortConnect();
				})
				.doOnCancel(this::abortConnect);
		});
	}

	private void abortConnect() {
		this.mcpSession.disconnect();
		transition(McpConnectionState.CONNECTING, McpConnectionState.DISCONNECTED);
	}

	private boolean transition(McpConnectionState from, McpConnectionState to) {
		if (!this.state.compareAndSet(from, to)) {
			return false;
		}
		logger.debug("Client state {} -> {}", from, to);
		this.listener.onStateChanged(from, to);
		return true;
	}

	/**
	 * 立即关闭客户端连接。所有未完成的请求以"Client disposed"失败。重复调用不产生额外效果。
	 */
	public void close() {
		McpConnectionState previous = this.state.getAndSet(McpConnectionState.DISPOSED);
		if (previous != McpConnectionState.DISPOSED) {
			this.listener.onStateChanged(previous, McpConnectionState.DISPOSED);
			this.mcpSession.close();
		}
	}

	/**
	 * 优雅地关闭客户端连接。
	 * @return 当连接关闭时完成的Mono
	 */
	public Mono<Void> closeGracefully() {
		return Mono.defer(() -> {
			McpConnectionState previous = this.state.getAndSet(McpConnectionState.DISPOSED);
			if (previous == McpConnectionState.DISPOSED) {
				return Mono.empty();
			}
			this.listener.onStateChanged(previous, McpConnectionState.DISPOSED);
			return this.mcpSession.closeGracefully();
		});
	}

	// --------------------------
	// Initialization
	// --------------------------

	/**
	 * 用配置的协议版本握手，必要时以旧版本重试一次。
	 */
	private Mono<McpSchema.InitializeResult> initializeWithFallback() {
		String preferred = this.options.protocolVersion();
		return initialize(preferred).onErrorResume(error -> shouldFallBack(error, preferred), error -> {
			logger.info("Server rejected protocol version {} ({}), retrying with {}", preferred, error.getMessage(),
					McpSchema.LEGACY_PROTOCOL_VERSION);
			return initialize(McpSchema.LEGACY_PROTOCOL_VERSION);
		});
	}

	static boolean shouldFallBack(Throwable error, String requestedVersion) {
		return error instanceof McpError && error.getMessage() != null
				&& error.getMessage().toLowerCase(Locale.ROOT).contains(INVALID_PARAMS_MARKER)
				&& !McpSchema.LEGACY_PROTOCOL_VERSION.equals(requestedVersion);
	}

	/**
	 * 对已连接的客户端重新握手。协议版本回退规则与{@link #connect()}相同。
	 * @return 握手结果
	 */
	public Mono<McpSchema.InitializeResult> initialize() {
		return this.withConnectionCheck("initializing", this::initializeWithFallback);
	}

	/**
	 * 发送一次{@code initialize}请求。
	 *
	 * <p>
	 * 成功后，若尚不知道会话ID而结果中带有{@code session_id}或{@code sessionId}，则采用它；
	 * 然后发送{@code notifications/initialized}通知。
	 */
	private Mono<McpSchema.InitializeResult> initialize(String version) {
		McpSchema.InitializeRequest initializeRequest = new McpSchema.InitializeRequest(// @formatter:off
				version,
				this.options.clientInfo(),
				this.options.capabilities()); // @formatter:on

		return this.mcpSession.sendRequest(McpSchema.METHOD_INITIALIZE, initializeRequest, JSON_NODE_TYPE_REF)
			.defaultIfEmpty(JsonNodeFactory.instance.objectNode())
			.flatMap(resultNode -> {
				adoptSessionId(resultNode);

				McpSchema.InitializeResult result = this.transport.unmarshalFrom(resultNode,
						INITIALIZE_RESULT_TYPE_REF);
				this.initializeResult = result;
				this.protocolVersion = version;

				logger.info("Server response with Protocol: {}, Capabilities: {}, Info: {} and Instructions {}",
						result.protocolVersion(), result.capabilities(), result.serverInfo(), result.instructions());

				return this.mcpSession.sendNotification(McpSchema.METHOD_NOTIFICATION_INITIALIZED, Map.of())
					.thenReturn(result);
			});
	}

	private void adoptSessionId(JsonNode resultNode) {
		for (String field : List.of("session_id", "sessionId")) {
			JsonNode value = resultNode.get(field);
			if (value != null && value.isValueNode() && this.mcpSession.adoptSessionIdIfAbsent(value.asText())) {
				logger.debug("Adopted session id from initialize result");
				return;
			}
		}
	}

	/**
	 * 在执行操作前检查连接状态。
	 * @param <T> 结果Mono的类型
	 * @param actionName 用于错误信息的操作名
	 * @param operation 客户端已连接时执行的操作
	 * @return 完成操作结果的Mono
	 */
	private <T> Mono<T> withConnectionCheck(String actionName, Supplier<Mono<T>> operation) {
		return Mono.defer(() -> {
			McpConnectionState current = this.state.get();
			if (current == McpConnectionState.DISPOSED) {
				return Mono.error(new IllegalStateException(McpClientSession.CLIENT_DISPOSED_MESSAGE));
			}
			if (current != McpConnectionState.CONNECTED) {
				return Mono.error(new McpError("Client must be connected before " + actionName));
			}
			return operation.get();
		});
	}

	// --------------------------
	// Generic primitives
	// --------------------------

	/**
	 * 发送任意JSON-RPC请求并返回未转换的结果（通常是{@link JsonNode}）。不要求握手已完成。
	 * @param method 方法名
	 * @param params 请求参数
	 * @return 发出结果的Mono；结果为空时直接完成
	 */
	public Mono<Object> sendRequest(String method, Object params) {
		return this.mcpSession.sendRequest(method, params);
	}

	public <T> Mono<T> sendRequest(String method, Object params, TypeReference<T> typeRef) {
		return this.mcpSession.sendRequest(method, params, typeRef);
	}

	/**
	 * 发送任意JSON-RPC通知。投递失败会传递给调用方。
	 * @param method 方法名
	 * @param params 通知参数
	 * @return 投递完成时完成的Mono
	 */
	public Mono<Void> sendNotification(String method, Object params) {
		return this.mcpSession.sendNotification(method, params);
	}

	// --------------------------
	// Basic Utilities
	// --------------------------

	/**
	 * 向服务器发送ping请求。
	 * @return 完成服务器ping响应的Mono
	 */
	public Mono<Object> ping() {
		return this.withConnectionCheck("pinging the server",
				() -> this.mcpSession.sendRequest(McpSchema.METHOD_PING, Map.of()));
	}

	// --------------------------
	// Tools
	// --------------------------
	private static final TypeReference<McpSchema.CallToolResult> CALL_TOOL_RESULT_TYPE_REF = new TypeReference<>() {
	};

	private static final TypeReference<McpSchema.ListToolsResult> LIST_TOOLS_RESULT_TYPE_REF = new TypeReference<>() {
	};

	/**
	 * 调用服务器提供的工具。
	 * @param callToolRequest 包含工具名称和输入参数的请求
	 * @return 发出工具调用结果的Mono
	 * @see #listTools()
	 */
	public Mono<McpSchema.CallToolResult> callTool(McpSchema.CallToolRequest callToolRequest) {
		return this.withConnectionCheck("calling tools", () -> this.mcpSession
			.sendRequest(McpSchema.METHOD_TOOLS_CALL, callToolRequest, CALL_TOOL_RESULT_TYPE_REF));
	}

	public Mono<McpSchema.CallToolResult> callTool(String name, Map<String, Object> arguments) {
		return callTool(new McpSchema.CallToolRequest(name, (arguments != null) ? arguments : Map.of()));
	}

	/**
	 * 获取服务器提供的工具列表的第一页。
	 * @return 发出工具列表的Mono
	 */
	public Mono<McpSchema.ListToolsResult> listTools() {
		return this.listTools(null);
	}

	/**
	 * 获取服务器提供的工具列表的一页。
	 * @param cursor 上一页结果中的{@code nextCursor}，第一页为{@code null}
	 * @return 发出工具列表的Mono
	 */
	public Mono<McpSchema.ListToolsResult> listTools(String cursor) {
		return this.withConnectionCheck("listing tools", () -> this.mcpSession
			.sendRequest(McpSchema.METHOD_TOOLS_LIST, new McpSchema.PaginatedRequest(cursor), LIST_TOOLS_RESULT_TYPE_REF));
	}

	private NotificationHandler asyncToolsChangeNotificationHandler(
			List<Function<List<McpSchema.Tool>, Mono<Void>>> toolsChangeConsumers) {
		return params -> this.listTools()
			.flatMap(listToolsResult -> Flux.fromIterable(toolsChangeConsumers)
				.flatMap(consumer -> consumer.apply(listToolsResult.tools()))
				.onErrorResume(error -> {
					logger.error("Error handling tools list change notification", error);
					return Mono.empty();
				})
				.then());
	}

	// --------------------------
	// Resources
	// --------------------------

	private static final TypeReference<McpSchema.ListResourcesResult> LIST_RESOURCES_RESULT_TYPE_REF = new TypeReference<>() {
	};

	private static final TypeReference<McpSchema.ReadResourceResult> READ_RESOURCE_RESULT_TYPE_REF = new TypeReference<>() {
	};

	public Mono<McpSchema.ListResourcesResult> listResources() {
		return this.listResources(null);
	}

	/**
	 * 获取服务器提供的资源列表的一页。
	 * @param cursor 上一页结果中的{@code nextCursor}，第一页为{@code null}
	 * @return 发出资源列表的Mono
	 */
	public Mono<McpSchema.ListResourcesResult> listResources(String cursor) {
		return this.withConnectionCheck("listing resources", () -> this.mcpSession.sendRequest(
				McpSchema.METHOD_RESOURCES_LIST, new McpSchema.PaginatedRequest(cursor), LIST_RESOURCES_RESULT_TYPE_REF));
	}

	public Mono<McpSchema.ReadResourceResult> readResource(String uri) {
		return this.readResource(new McpSchema.ReadResourceRequest(uri));
	}

	public Mono<McpSchema.ReadResourceResult> readResource(McpSchema.Resource resource) {
		return this.readResource(new McpSchema.ReadResourceRequest(resource.uri()));
	}

	/**
	 * 读取资源内容。
	 * @param readResourceRequest 包含资源URI的请求
	 * @return 发出资源内容的Mono
	 */
	public Mono<McpSchema.ReadResourceResult> readResource(McpSchema.ReadResourceRequest readResourceRequest) {
		return this.withConnectionCheck("reading resources", () -> this.mcpSession
			.sendRequest(McpSchema.METHOD_RESOURCES_READ, readResourceRequest, READ_RESOURCE_RESULT_TYPE_REF));
	}

	private NotificationHandler asyncResourcesChangeNotificationHandler(
			List<Function<List<McpSchema.Resource>, Mono<Void>>> resourcesChangeConsumers) {
		return params -> listResources().flatMap(listResourcesResult -> Flux.fromIterable(resourcesChangeConsumers)
			.flatMap(consumer -> consumer.apply(listResourcesResult.resources()))
			.onErrorResume(error -> {
				logger.error("Error handling resources list change notification", error);
				return Mono.empty();
			})
			.then());
	}

	// --------------------------
	// State
	// --------------------------

	public McpConnectionState getState() {
		return this.state.get();
	}

	public boolean isConnected() {
		return this.state.get() == McpConnectionState.CONNECTED;
	}

	public String getSessionId() {
		String sessionId = this.mcpSession.getSessionId();
		return Utils.hasText(sessionId) ? sessionId : this.transport.getSessionId();
	}

	public URI getSubmissionEndpoint() {
		return this.transport.getSubmissionEndpoint();
	}

	/**
	 * @return 最近一次成功握手使用的协议版本，尚未握手时为{@code null}
	 */
	public String getProtocolVersion() {
		return this.protocolVersion;
	}

	public McpSchema.Implementation getServerInfo() {
		McpSchema.InitializeResult result = this.initializeResult;
		return (result != null) ? result.serverInfo() : null;
	}

	public McpSchema.ServerCapabilities getServerCapabilities() {
		McpSchema.InitializeResult result = this.initializeResult;
		return (result != null) ? result.capabilities() : null;
	}

	public String getServerInstructions() {
		McpSchema.InitializeResult result = this.initializeResult;
		return (result != null) ? result.instructions() : null;
	}

	public McpClientOptions getOptions() {
		return this.options;
	}

	public int getPendingRequestCount() {
		return this.mcpSession.getPendingRequestCount();
	}

}
