/*
 * Copyright 2024-2024 the original author or authors.
 */
package io.ssemcp.client;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import io.ssemcp.spec.McpSchema;
import io.ssemcp.util.Assert;

/**
 * 客户端在构造时接收、之后不再改变的配置。
 *
 * @param clientName 握手时上报的客户端名称
 * @param clientVersion 握手时上报的客户端版本
 * @param protocolVersion 首选的协议版本
 * @param capabilities 握手时上报的客户端能力，原样发送
 * @param headers 附加在事件流请求和消息投递请求上的请求头
 */
public record McpClientOptions(String clientName, String clientVersion, String protocolVersion,
		Map<String, Object> capabilities, Map<String, String> headers) {

	public static final String DEFAULT_CLIENT_NAME = "sse-mcp-client";

	public static final String DEFAULT_CLIENT_VERSION = "1.0.0";

	public McpClientOptions {
		Assert.hasText(clientName, "clientName must not be empty");
		Assert.hasText(clientVersion, "clientVersion must not be empty");
		Assert.hasText(protocolVersion, "protocolVersion must not be empty");
		capabilities = Collections.unmodifiableMap(new LinkedHashMap<>(capabilities != null ? capabilities : Map.of()));
		headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers != null ? headers : Map.of()));
	}

	public static McpClientOptions defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @return 握手请求中的客户端信息
	 */
	public McpSchema.Implementation clientInfo() {
		return new McpSchema.Implementation(this.clientName, this.clientVersion);
	}

	public static class Builder {

		private String clientName = DEFAULT_CLIENT_NAME;

		private String clientVersion = DEFAULT_CLIENT_VERSION;

		private String protocolVersion = McpSchema.LATEST_PROTOCOL_VERSION;

		private final Map<String, Object> capabilities = new LinkedHashMap<>();

		private final Map<String, String> headers = new LinkedHashMap<>();

		Builder() {
		}

		public Builder clientName(String clientName) {
			this.clientName = clientName;
			return this;
		}

		public Builder clientVersion(String clientVersion) {
			this.clientVersion = clientVersion;
			return this;
		}

		public Builder protocolVersion(String protocolVersion) {
			this.protocolVersion = protocolVersion;
			return this;
		}

		public Builder capabilities(Map<String, Object> capabilities) {
			Assert.notNull(capabilities, "capabilities must not be null");
			this.capabilities.putAll(capabilities);
			return this;
		}

		public Builder capability(String name, Object value) {
			Assert.hasText(name, "capability name must not be empty");
			this.capabilities.put(name, value);
			return this;
		}

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

		public McpClientOptions build() {
			return new McpClientOptions(this.clientName, this.clientVersion, this.protocolVersion, this.capabilities,
					this.headers);
		}

	}

}
