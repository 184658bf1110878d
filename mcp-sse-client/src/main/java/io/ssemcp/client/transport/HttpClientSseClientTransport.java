/*
 * Copyright 2024 - 2024 the original author or authors.
 */
package io.ssemcp.client.transport;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.ssemcp.spec.McpClientTransport;
import io.ssemcp.spec.McpSchema.JSONRPCMessage;
import io.ssemcp.spec.StreamEvent;
import io.ssemcp.util.Assert;
import io.ssemcp.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * 使用Java的HttpClient实现的服务器发送事件(SSE)传输层，实现了{@link McpClientTransport}接口。
 *
 * <p>
 * 服务器到客户端的消息通过事件流到达，客户端到服务器的消息通过HTTP POST投递到提交端点。该传输：
 * <ul>
 * <li>先按标准事件流协商打开连接，失败时在同一地址上改用逐块读取，连接建立前只做一次选择</li>
 * <li>根据{@code endpoint}事件解析提交端点，并从其{@code session_id}查询参数中获取会话ID</li>
 * <li>提交端点未知时投递到{@code {origin}/messages/}，{@code origin}为连接地址去掉结尾的{@code /sse}</li>
 * <li>在地址查询参数和消息体中携带会话ID</li>
 * </ul>
 *
 * @author Christian Tzolov
 * @see McpClientTransport
 */
public class HttpClientSseClientTransport implements McpClientTransport {

	private static final Logger logger = LoggerFactory.getLogger(HttpClientSseClientTransport.class);

	/** 查询参数和消息体中会话ID的名称 */
	public static final String SESSION_ID_PARAMETER = "session_id";

	/** 提交端点未知时使用的路径 */
	private static final String DEFAULT_MESSAGES_PATH = "/messages/";

	/** 事件流连接地址 */
	private final URI streamUri;

	/** 去掉结尾 /sse 的连接地址 */
	private final String baseOrigin;

	/** 事件流请求和消息投递请求都附加的请求头 */
	private final Map<String, String> headers;

	/**
	 * 用于打开事件流和投递消息的HTTP客户端
	 */
	private final HttpClient httpClient;

	private final FlowSseClient sseClient;

	private final HttpStreamingSseReader streamingReader;

	/** 用于消息序列化/反序列化的JSON对象映射器 */
	protected ObjectMapper objectMapper;

	private final AtomicReference<URI> submissionEndpoint = new AtomicReference<>();

	private final AtomicReference<String> sessionId = new AtomicReference<>();

	private final AtomicBoolean closed = new AtomicBoolean(false);

	/** 关闭时发出信号，结束所有已打开的事件序列 */
	private final Sinks.One<Boolean> closeSignal = Sinks.one();

	/**
	 * 使用自定义HTTP客户端、对象映射器和请求头创建新的传输实例。
	 * @param httpClient 要使用的HTTP客户端
	 * @param streamUri 事件流连接地址
	 * @param headers 附加的请求头
	 * @param objectMapper 用于JSON序列化/反序列化的对象映射器
	 */
	HttpClientSseClientTransport(HttpClient httpClient, String streamUri, Map<String, String> headers,
			ObjectMapper objectMapper) {
		Assert.notNull(objectMapper, "ObjectMapper must not be null");
		Assert.hasText(streamUri, "baseUri must not be empty");
		Assert.notNull(httpClient, "httpClient must not be null");
		Assert.notNull(headers, "headers must not be null");
		this.streamUri = URI.create(streamUri.trim());
		this.baseOrigin = Utils.baseOrigin(this.streamUri);
		this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
		this.objectMapper = objectMapper;
		this.httpClient = httpClient;
		this.sseClient = new FlowSseClient(httpClient);
		this.streamingReader = new HttpStreamingSseReader(httpClient);
	}

	/**
	 * 创建{@link HttpClientSseClientTransport}的新构建器。
	 * @param baseUri 事件流连接地址，例如{@code https://host/sse}
	 * @return 新的构建器实例
	 */
	public static Builder builder(String baseUri) {
		return new Builder().baseUri(baseUri);
	}

	/**
	 * {@link HttpClientSseClientTransport}的构建器。
	 */
	public static class Builder {

		private String baseUri;

		private final Map<String, String> headers = new LinkedHashMap<>();

		private HttpClient.Builder clientBuilder = HttpClient.newBuilder()
			.version(HttpClient.Version.HTTP_1_1)
			.connectTimeout(Duration.ofSeconds(10));

		private ObjectMapper objectMapper = new ObjectMapper();

		Builder() {
		}

		Builder baseUri(String baseUri) {
			Assert.hasText(baseUri, "baseUri must not be empty");
			this.baseUri = baseUri;
			return this;
		}

		/**
		 * 添加一个附加在所有请求上的请求头，同名时替换。
		 * @param name 请求头名称
		 * @param value 请求头值
		 * @return 此构建器
		 */
		public Builder header(String name, String value) {
			Assert.hasText(name, "header name must not be empty");
			Assert.notNull(value, "header value must not be null");
			this.headers.put(name, value);
			return this;
		}

		public Builder headers(Map<String, String> headers) {
			Assert.notNull(headers, "headers must not be null");
			headers.forEach(this::header);
			return this;
		}

		/**
		 * 设置{@code Authorization: Bearer <token>}请求头。
		 * @param token 访问令牌
		 * @return 此构建器
		 */
		public Builder bearerToken(String token) {
			Assert.hasText(token, "token must not be empty");
			return header("Authorization", "Bearer " + token);
		}

		/**
		 * 设置HTTP客户端构建器。
		 * @param clientBuilder HTTP客户端构建器
		 * @return 此构建器
		 */
		public Builder clientBuilder(HttpClient.Builder clientBuilder) {
			Assert.notNull(clientBuilder, "clientBuilder must not be null");
			this.clientBuilder = clientBuilder;
			return this;
		}

		/**
		 * 自定义HTTP客户端构建器。
		 * @param clientCustomizer 用于自定义HTTP客户端构建器的消费者
		 * @return 此构建器
		 */
		public Builder customizeClient(final Consumer<HttpClient.Builder> clientCustomizer) {
			Assert.notNull(clientCustomizer, "clientCustomizer must not be null");
			clientCustomizer.accept(clientBuilder);
			return this;
		}

		public Builder connectTimeout(Duration connectTimeout) {
			Assert.notNull(connectTimeout, "connectTimeout must not be null");
			this.clientBuilder.connectTimeout(connectTimeout);
			return this;
		}

		/**
		 * 设置用于JSON序列化/反序列化的对象映射器。
		 * @param objectMapper 对象映射器
		 * @return 此构建器
		 */
		public Builder objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "objectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		/**
		 * 构建新的{@link HttpClientSseClientTransport}实例。
		 * @return 新的传输实例
		 */
		public HttpClientSseClientTransport build() {
			return new HttpClientSseClientTransport(clientBuilder.build(), baseUri, headers, objectMapper);
		}

	}

	/**
	 * 打开事件流。每次调用都会清除已解析的提交端点，并重新决定使用哪种读取方式。
	 * @return 发出事件序列的Mono；两种方式都无法打开时以最后一个错误结束
	 */
	@Override
	public Mono<Flux<StreamEvent>> connect() {
		return Mono.defer(() -> {
			if (this.closed.get()) {
				return Mono.error(new IllegalStateException("Transport closed"));
			}
			this.submissionEndpoint.set(null);

			return this.sseClient.open(this.streamUri, this.headers)
				.doOnNext(events -> logger.info("Event stream opened at {}", this.streamUri))
				.onErrorResume(error -> {
					logger.info("Standard event stream unavailable at {} ({}), falling back to streaming read",
							this.streamUri, error.getMessage());
					return this.streamingReader.open(this.streamUri, this.headers)
						.doOnNext(events -> logger.info("Event stream opened at {} using streaming read",
								this.streamUri));
				})
				.map(events -> events.takeUntilOther(this.closeSignal.asMono()));
		});
	}

	/**
	 * 绝对的http/https地址原样使用，否则相对于连接地址的origin解析。每个连接只接受第一次公告。
	 */
	@Override
	public URI setSubmissionEndpointFromEvent(String rawValue) {
		Assert.notNull(rawValue, "rawValue must not be null");
		String value = rawValue.trim();

		URI current = this.submissionEndpoint.get();
		if (current != null) {
			logger.warn("Ignoring repeated endpoint announcement '{}', keeping {}", value, current);
			return current;
		}

		URI resolved = Utils.isAbsoluteHttpUri(value) ? URI.create(value)
				: URI.create(this.baseOrigin + (value.startsWith("/") ? value : "/" + value));
		if (!this.submissionEndpoint.compareAndSet(null, resolved)) {
			return this.submissionEndpoint.get();
		}

		String announcedSessionId = Utils.queryParameter(resolved, SESSION_ID_PARAMETER);
		if (Utils.hasText(announcedSessionId)) {
			this.sessionId.set(announcedSessionId);
		}
		return resolved;
	}

	@Override
	public URI getSubmissionEndpoint() {
		return this.submissionEndpoint.get();
	}

	@Override
	public String getSessionId() {
		return this.sessionId.get();
	}

	@Override
	public void setSessionId(String sessionId) {
		this.sessionId.set(sessionId);
	}

	public URI getStreamUri() {
		return this.streamUri;
	}

	public Map<String, String> getHeaders() {
		return this.headers;
	}

	/**
	 * 向提交端点POST JSON-RPC消息。
	 *
	 * <p>
	 * 消息体是消息本身加上顶层的{@code session_id}字段，后者总是取自传输层当前已知的会话ID（可能为null）。
	 * 状态码不低于400时以{@link MessageDeliveryException}失败。
	 * @param message 要发送的JSON-RPC消息
	 * @return 当服务器接收消息时完成的Mono
	 */
	@Override
	public Mono<Void> sendMessage(JSONRPCMessage message) {
		return Mono.defer(() -> {
			if (this.closed.get()) {
				return Mono.error(new IllegalStateException("Transport closed"));
			}

			URI target = resolveTarget();
			String jsonText;
			try {
				jsonText = this.objectMapper.writeValueAsString(withSessionId(message));
			}
			catch (IOException e) {
				return Mono.error(new RuntimeException("Failed to serialize message", e));
			}

			HttpRequest.Builder builder = HttpRequest.newBuilder(target).header("Content-Type", "application/json");
			this.headers.forEach(builder::setHeader);
			HttpRequest request = builder.POST(HttpRequest.BodyPublishers.ofString(jsonText)).build();

			return Mono.fromFuture(() -> this.httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString()))
				.flatMap(response -> {
					if (response.statusCode() >= 400) {
						return Mono.error(new MessageDeliveryException(target, response.statusCode(), response.body()));
					}
					return Mono.<Void>empty();
				});
		});
	}

	/**
	 * 已解析的提交端点或默认端点，必要时补上{@code session_id}查询参数。已有该参数时不覆盖。
	 */
	URI resolveTarget() {
		URI endpoint = this.submissionEndpoint.get();
		if (endpoint == null) {
			endpoint = URI.create(this.baseOrigin + DEFAULT_MESSAGES_PATH);
		}
		String currentSessionId = this.sessionId.get();
		if (currentSessionId != null && Utils.queryParameter(endpoint, SESSION_ID_PARAMETER) == null) {
			endpoint = Utils.withQueryParameter(endpoint, SESSION_ID_PARAMETER, currentSessionId);
		}
		return endpoint;
	}

	ObjectNode withSessionId(JSONRPCMessage message) {
		ObjectNode body = this.objectMapper.createObjectNode();
		String currentSessionId = this.sessionId.get();
		if (currentSessionId != null) {
			body.put(SESSION_ID_PARAMETER, currentSessionId);
		}
		else {
			body.putNull(SESSION_ID_PARAMETER);
		}
		ObjectNode payload = this.objectMapper.valueToTree(message);
		payload.fields().forEachRemaining(field -> {
			if (!SESSION_ID_PARAMETER.equals(field.getKey())) {
				body.set(field.getKey(), field.getValue());
			}
		});
		return body;
	}

	/**
	 * 结束已打开的事件序列并中止底层请求。重复调用不产生额外效果。
	 * @return 当关闭完成时完成的Mono
	 */
	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(() -> {
			if (this.closed.compareAndSet(false, true)) {
				logger.debug("Closing transport for {}", this.streamUri);
				this.closeSignal.tryEmitValue(Boolean.TRUE);
			}
		});
	}

	public boolean isClosed() {
		return this.closed.get();
	}

	/**
	 * 使用配置的对象映射器将数据反序列化为指定类型。
	 * @param data 要反序列化的数据
	 * @param typeRef 目标类型的类型引用
	 * @param <T> 目标类型
	 * @return 反序列化后的对象
	 */
	@Override
	public <T> T unmarshalFrom(Object data, TypeReference<T> typeRef) {
		return this.objectMapper.convertValue(data, typeRef);
	}

}
