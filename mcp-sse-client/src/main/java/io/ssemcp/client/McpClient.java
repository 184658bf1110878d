/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.ssemcp.client;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.ssemcp.client.transport.HttpClientSseClientTransport;
import io.ssemcp.spec.McpClientListener;
import io.ssemcp.spec.McpClientSession;
import io.ssemcp.spec.McpClientSession.NotificationHandler;
import io.ssemcp.spec.McpClientTransport;
import io.ssemcp.spec.McpSchema;
import io.ssemcp.spec.RequestIdGenerator;
import io.ssemcp.util.Assert;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * 用于创建MCP客户端的工厂类。
 *
 * <p>
 * 该类提供了用于创建同步和异步客户端的工厂方法，客户端可以基于现有的传输层创建，
 * 也可以直接给出事件流地址（例如{@code https://host/sse}），由构建器创建
 * {@link HttpClientSseClientTransport}并带上选项中的请求头。
 *
 * <p>
 * 创建同步客户端的示例：<pre>{@code
 * McpSyncClient client = McpClient.sync("https://host/sse")
 *     .options(McpClientOptions.builder().bearerToken(token).build())
 *     .requestTimeout(Duration.ofSeconds(10))
 *     .build();
 * client.connect();
 * }</pre>
 *
 * @author Christian Tzolov
 * @author Dariusz Jędrzejczyk
 * @see McpAsyncClient
 * @see McpSyncClient
 */
public interface McpClient {

	Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(60);

	Duration DEFAULT_CONNECT_GRACE_PERIOD = Duration.ofMillis(200);

	/**
	 * 使用给定的传输层开始构建同步MCP客户端。
	 * @param transport 传输层
	 * @return 用于配置客户端的新构建器
	 */
	static SyncSpec sync(McpClientTransport transport) {
		return new SyncSpec(transport, null);
	}

	/**
	 * 使用事件流地址开始构建同步MCP客户端。
	 * @param baseUrl 事件流地址
	 * @return 用于配置客户端的新构建器
	 */
	static SyncSpec sync(String baseUrl) {
		Assert.hasText(baseUrl, "baseUrl must not be empty");
		return new SyncSpec(null, baseUrl);
	}

	/**
	 * 使用给定的传输层开始构建异步MCP客户端。
	 * @param transport 传输层
	 * @return 用于配置客户端的新构建器
	 */
	static AsyncSpec async(McpClientTransport transport) {
		return new AsyncSpec(transport, null);
	}

	/**
	 * 使用事件流地址开始构建异步MCP客户端。
	 * @param baseUrl 事件流地址
	 * @return 用于配置客户端的新构建器
	 */
	static AsyncSpec async(String baseUrl) {
		Assert.hasText(baseUrl, "baseUrl must not be empty");
		return new AsyncSpec(null, baseUrl);
	}

	private static McpClientTransport resolveTransport(McpClientTransport transport, String baseUrl,
			McpClientOptions options, ObjectMapper objectMapper) {
		if (transport != null) {
			return transport;
		}
		return HttpClientSseClientTransport.builder(baseUrl)
			.headers(options.headers())
			.objectMapper(objectMapper)
			.build();
	}

	/**
	 * 异步客户端的构建器。
	 *
	 * <ul>
	 * <li>请求超时，默认60秒</li>
	 * <li>握手前的宽限期，默认200毫秒</li>
	 * <li>请求ID生成器、超时调度器和观察钩子</li>
	 * <li>服务器通知处理器</li>
	 * </ul>
	 */
	class AsyncSpec {

		private final McpClientTransport transport;

		private final String baseUrl;

		private McpClientOptions options = McpClientOptions.defaults();

		private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;

		private Duration connectGracePeriod = DEFAULT_CONNECT_GRACE_PERIOD;

		private RequestIdGenerator requestIdGenerator = RequestIdGenerator.uuid();

		private Scheduler timeoutScheduler = Schedulers.parallel();

		private McpClientListener listener = McpClientListener.NOOP;

		private ObjectMapper objectMapper = new ObjectMapper();

		private final Map<String, NotificationHandler> notificationHandlers = new LinkedHashMap<>();

		private final List<Function<List<McpSchema.Tool>, Mono<Void>>> toolsChangeConsumers = new ArrayList<>();

		private final List<Function<List<McpSchema.Resource>, Mono<Void>>> resourcesChangeConsumers = new ArrayList<>();

		private AsyncSpec(McpClientTransport transport, String baseUrl) {
			Assert.isTrue(transport != null || baseUrl != null, "Transport must not be null");
			this.transport = transport;
			this.baseUrl = baseUrl;
		}

		public AsyncSpec options(McpClientOptions options) {
			Assert.notNull(options, "Options must not be null");
			this.options = options;
			return this;
		}

		/**
		 * 设置等待响应的时间。适用于通过客户端发出的所有请求，包括握手。
		 * @param requestTimeout 请求超时前等待的持续时间，必须为正
		 * @return 用于方法链接的此构建器实例
		 */
		public AsyncSpec requestTimeout(Duration requestTimeout) {
			Assert.notNull(requestTimeout, "Request timeout must not be null");
			this.requestTimeout = requestTimeout;
			return this;
		}

		/**
		 * 设置事件流打开后、发送握手请求前的等待时间，让服务器有机会先公告提交端点。
		 * @param connectGracePeriod 等待时间，可以为零
		 * @return 用于方法链接的此构建器实例
		 */
		public AsyncSpec connectGracePeriod(Duration connectGracePeriod) {
			Assert.notNull(connectGracePeriod, "Connect grace period must not be null");
			this.connectGracePeriod = connectGracePeriod;
			return this;
		}

		public AsyncSpec requestIdGenerator(RequestIdGenerator requestIdGenerator) {
			Assert.notNull(requestIdGenerator, "Request id generator must not be null");
			this.requestIdGenerator = requestIdGenerator;
			return this;
		}

		/**
		 * 设置运行请求超时计时器和握手宽限期的调度器。
		 * @param timeoutScheduler 调度器
		 * @return 用于方法链接的此构建器实例
		 */
		public AsyncSpec timeoutScheduler(Scheduler timeoutScheduler) {
			Assert.notNull(timeoutScheduler, "Timeout scheduler must not be null");
			this.timeoutScheduler = timeoutScheduler;
			return this;
		}

		public AsyncSpec listener(McpClientListener listener) {
			Assert.notNull(listener, "Listener must not be null");
			this.listener = listener;
			return this;
		}

		public AsyncSpec objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "Object mapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		/**
		 * 为服务器发起的通知注册处理器。方法名为{@link McpClientSession#ANY_NOTIFICATION}时，
		 * 处理所有没有专门处理器的通知。
		 * @param method 通知方法名
		 * @param handler 处理器，失败只会被记录
		 * @return 用于方法链接的此构建器实例
		 */
		public AsyncSpec notificationHandler(String method, NotificationHandler handler) {
			Assert.hasText(method, "Method must not be empty");
			Assert.notNull(handler, "Notification handler must not be null");
			this.notificationHandlers.put(method, handler);
			return this;
		}

		/**
		 * 添加在服务器工具列表变化后接收最新列表的消费者。
		 * @param toolsChangeConsumer 接收工具列表的消费者
		 * @return 用于方法链接的此构建器实例
		 */
		public AsyncSpec toolsChangeConsumer(Function<List<McpSchema.Tool>, Mono<Void>> toolsChangeConsumer) {
			Assert.notNull(toolsChangeConsumer, "Tools change consumer must not be null");
			this.toolsChangeConsumers.add(toolsChangeConsumer);
			return this;
		}

		public AsyncSpec resourcesChangeConsumer(
				Function<List<McpSchema.Resource>, Mono<Void>> resourcesChangeConsumer) {
			Assert.notNull(resourcesChangeConsumer, "Resources change consumer must not be null");
			this.resourcesChangeConsumers.add(resourcesChangeConsumer);
			return this;
		}

		/**
		 * 创建异步客户端。客户端处于断开状态，需要调用{@link McpAsyncClient#connect()}。
		 * @return 新的{@link McpAsyncClient}
		 */
		public McpAsyncClient build() {
			McpClientTransport clientTransport = resolveTransport(this.transport, this.baseUrl, this.options,
					this.objectMapper);
			return new McpAsyncClient(clientTransport, this.requestTimeout, this.connectGracePeriod,
					this.requestIdGenerator, this.timeoutScheduler, this.listener, this.objectMapper,
					new McpClientFeatures.Async(this.options, this.notificationHandlers, this.toolsChangeConsumers,
							this.resourcesChangeConsumers));
		}

	}

	/**
	 * 同步客户端的构建器，配置项与{@link AsyncSpec}相同，处理器为阻塞式。
	 */
	class SyncSpec {

		private final McpClientTransport transport;

		private final String baseUrl;

		private McpClientOptions options = McpClientOptions.defaults();

		private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;

		private Duration connectGracePeriod = DEFAULT_CONNECT_GRACE_PERIOD;

		private RequestIdGenerator requestIdGenerator = RequestIdGenerator.uuid();

		private Scheduler timeoutScheduler = Schedulers.parallel();

		private McpClientListener listener = McpClientListener.NOOP;

		private ObjectMapper objectMapper = new ObjectMapper();

		private final Map<String, Consumer<Object>> notificationHandlers = new LinkedHashMap<>();

		private final List<Consumer<List<McpSchema.Tool>>> toolsChangeConsumers = new ArrayList<>();

		private final List<Consumer<List<McpSchema.Resource>>> resourcesChangeConsumers = new ArrayList<>();

		private SyncSpec(McpClientTransport transport, String baseUrl) {
			Assert.isTrue(transport != null || baseUrl != null, "Transport must not be null");
			this.transport = transport;
			this.baseUrl = baseUrl;
		}

		public SyncSpec options(McpClientOptions options) {
			Assert.notNull(options, "Options must not be null");
			this.options = options;
			return this;
		}

		public SyncSpec requestTimeout(Duration requestTimeout) {
			Assert.notNull(requestTimeout, "Request timeout must not be null");
			this.requestTimeout = requestTimeout;
			return this;
		}

		public SyncSpec connectGracePeriod(Duration connectGracePeriod) {
			Assert.notNull(connectGracePeriod, "Connect grace period must not be null");
			this.connectGracePeriod = connectGracePeriod;
			return this;
		}

		public SyncSpec requestIdGenerator(RequestIdGenerator requestIdGenerator) {
			Assert.notNull(requestIdGenerator, "Request id generator must not be null");
			this.requestIdGenerator = requestIdGenerator;
			return this;
		}

		public SyncSpec timeoutScheduler(Scheduler timeoutScheduler) {
			Assert.notNull(timeoutScheduler, "Timeout scheduler must not be null");
			this.timeoutScheduler = timeoutScheduler;
			return this;
		}

		public SyncSpec listener(McpClientListener listener) {
			Assert.notNull(listener, "Listener must not be null");
			this.listener = listener;
			return this;
		}

		public SyncSpec objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "Object mapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		/**
		 * 为服务器发起的通知注册阻塞式处理器，处理器在有界弹性调度器上执行。
		 * @param method 通知方法名，或{@link McpClientSession#ANY_NOTIFICATION}
		 * @param handler 接收通知参数的消费者
		 * @return 用于方法链接的此构建器实例
		 */
		public SyncSpec notificationHandler(String method, Consumer<Object> handler) {
			Assert.hasText(method, "Method must not be empty");
			Assert.notNull(handler, "Notification handler must not be null");
			this.notificationHandlers.put(method, handler);
			return this;
		}

		public SyncSpec toolsChangeConsumer(Consumer<List<McpSchema.Tool>> toolsChangeConsumer) {
			Assert.notNull(toolsChangeConsumer, "Tools change consumer must not be null");
			this.toolsChangeConsumers.add(toolsChangeConsumer);
			return this;
		}

		public SyncSpec resourcesChangeConsumer(Consumer<List<McpSchema.Resource>> resourcesChangeConsumer) {
			Assert.notNull(resourcesChangeConsumer, "Resources change consumer must not be null");
			this.resourcesChangeConsumers.add(resourcesChangeConsumer);
			return this;
		}

		public McpSyncClient build() {
			McpClientFeatures.Sync syncFeatures = new McpClientFeatures.Sync(this.options, this.notificationHandlers,
					this.toolsChangeConsumers, this.resourcesChangeConsumers);
			McpClientTransport clientTransport = resolveTransport(this.transport, this.baseUrl, this.options,
					this.objectMapper);
			McpAsyncClient asyncClient = new McpAsyncClient(clientTransport, this.requestTimeout,
					this.connectGracePeriod, this.requestIdGenerator, this.timeoutScheduler, this.listener,
					this.objectMapper, McpClientFeatures.Async.fromSync(syncFeatures));
			return new McpSyncClient(asyncClient);
		}

	}

}
