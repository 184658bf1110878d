/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.ssemcp.client;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import io.ssemcp.spec.McpConnectionState;
import io.ssemcp.spec.McpSchema;
import io.ssemcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 包装{@link McpAsyncClient}的同步客户端，所有操作阻塞到完成、失败或各自的请求超时。
 *
 * <p>
 * 此实现实现了{@link AutoCloseable}接口用于资源清理，并提供了即时和优雅关闭选项。
 *
 * @author Dariusz Jędrzejczyk
 * @author Christian Tzolov
 * @see McpClient
 * @see McpAsyncClient
 */
public class McpSyncClient implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(McpSyncClient.class);

	private static final long DEFAULT_CLOSE_TIMEOUT_MS = 10_000L;

	private final McpAsyncClient delegate;

	/**
	 * 使用给定的委托创建新的McpSyncClient。
	 * @param delegate 异步内核，此同步客户端在其之上提供阻塞式API
	 */
	McpSyncClient(McpAsyncClient delegate) {
		Assert.notNull(delegate, "The delegate can not be null");
		this.delegate = delegate;
	}

	/**
	 * 打开事件流并完成握手。
	 * @return 握手结果
	 */
	public McpSchema.InitializeResult connect() {
		return this.delegate.connect().block();
	}

	public McpSchema.InitializeResult initialize() {
		return this.delegate.initialize().block();
	}

	@Override
	public void close() {
		this.delegate.close();
	}

	public boolean closeGracefully() {
		try {
			this.delegate.closeGracefully().block(Duration.ofMillis(DEFAULT_CLOSE_TIMEOUT_MS));
		}
		catch (RuntimeException e) {
			logger.warn("Client didn't close within timeout of {} ms.", DEFAULT_CLOSE_TIMEOUT_MS, e);
			return false;
		}
		return true;
	}

	public Object sendRequest(String method, Object params) {
		return this.delegate.sendRequest(method, params).block();
	}

	public <T> T sendRequest(String method, Object params, TypeReference<T> typeRef) {
		return this.delegate.sendRequest(method, params, typeRef).block();
	}

	public void sendNotification(String method, Object params) {
		this.delegate.sendNotification(method, params).block();
	}

	public Object ping() {
		return this.delegate.ping().block();
	}

	// --------------------------
	// Tools
	// --------------------------

	public McpSchema.CallToolResult callTool(McpSchema.CallToolRequest callToolRequest) {
		return this.delegate.callTool(callToolRequest).block();
	}

	public McpSchema.CallToolResult callTool(String name, Map<String, Object> arguments) {
		return this.delegate.callTool(name, arguments).block();
	}

	public McpSchema.ListToolsResult listTools() {
		return this.delegate.listTools().block();
	}

	public McpSchema.ListToolsResult listTools(String cursor) {
		return this.delegate.listTools(cursor).block();
	}

	// --------------------------
	// Resources
	// --------------------------

	public McpSchema.ListResourcesResult listResources() {
		return this.delegate.listResources().block();
	}

	public McpSchema.ListResourcesResult listResources(String cursor) {
		return this.delegate.listResources(cursor).block();
	}

	public McpSchema.ReadResourceResult readResource(String uri) {
		return this.delegate.readResource(uri).block();
	}

	public McpSchema.ReadResourceResult readResource(McpSchema.Resource resource) {
		return this.delegate.readResource(resource).block();
	}

	public McpSchema.ReadResourceResult readResource(McpSchema.ReadResourceRequest readResourceRequest) {
		return this.delegate.readResource(readResourceRequest).block();
	}

	// --------------------------
	// State
	// --------------------------

	public McpConnectionState getState() {
		return this.delegate.getState();
	}

	public boolean isConnected() {
		return this.delegate.isConnected();
	}

	public String getSessionId() {
		return this.delegate.getSessionId();
	}

	public URI getSubmissionEndpoint() {
		return this.delegate.getSubmissionEndpoint();
	}

	public String getProtocolVersion() {
		return this.delegate.getProtocolVersion();
	}

	public McpSchema.Implementation getServerInfo() {
		return this.delegate.getServerInfo();
	}

	public McpSchema.ServerCapabilities getServerCapabilities() {
		return this.delegate.getServerCapabilities();
	}

	public String getServerInstructions() {
		return this.delegate.getServerInstructions();
	}

	public int getPendingRequestCount() {
		return this.delegate.getPendingRequestCount();
	}

}
