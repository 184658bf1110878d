/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.ssemcp.client;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

import io.ssemcp.spec.McpClientSession.NotificationHandler;
import io.ssemcp.spec.McpSchema;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 客户端在构建时收集的选项与服务器通知处理器，分为异步和同步两种形式。
 *
 * @author Dariusz Jędrzejczyk
 */
class McpClientFeatures {

	/**
	 * 异步客户端的功能集合。
	 *
	 * @param options 客户端选项
	 * @param notificationHandlers 按方法名注册的通知处理器
	 * @param toolsChangeConsumers 工具列表变化后接收最新列表的消费者
	 * @param resourcesChangeConsumers 资源列表变化后接收最新列表的消费者
	 */
	record Async(McpClientOptions options, Map<String, NotificationHandler> notificationHandlers,
			List<Function<List<McpSchema.Tool>, Mono<Void>>> toolsChangeConsumers,
			List<Function<List<McpSchema.Resource>, Mono<Void>>> resourcesChangeConsumers) {

		Async(McpClientOptions options, Map<String, NotificationHandler> notificationHandlers,
				List<Function<List<McpSchema.Tool>, Mono<Void>>> toolsChangeConsumers,
				List<Function<List<McpSchema.Resource>, Mono<Void>>> resourcesChangeConsumers) {
			this.options = (options != null) ? options : McpClientOptions.defaults();
			this.notificationHandlers = (notificationHandlers != null) ? Map.copyOf(notificationHandlers) : Map.of();
			this.toolsChangeConsumers = (toolsChangeConsumers != null) ? List.copyOf(toolsChangeConsumers) : List.of();
			this.resourcesChangeConsumers = (resourcesChangeConsumers != null) ? List.copyOf(resourcesChangeConsumers)
					: List.of();
		}

		/**
		 * 把同步功能转换为异步功能，阻塞的消费者在有界弹性调度器上执行。
		 * @param syncSpec 同步功能
		 * @return 对应的异步功能
		 */
		static Async fromSync(Sync syncSpec) {
			Map<String, NotificationHandler> notificationHandlers = new LinkedHashMap<>();
			syncSpec.notificationHandlers()
				.forEach((method, consumer) -> notificationHandlers.put(method,
						params -> Mono.<Void>fromRunnable(() -> consumer.accept(params))
							.subscribeOn(Schedulers.boundedElastic())));

			List<Function<List<McpSchema.Tool>, Mono<Void>>> toolsChangeConsumers = new ArrayList<>();
			for (Consumer<List<McpSchema.Tool>> consumer : syncSpec.toolsChangeConsumers()) {
				toolsChangeConsumers.add(t -> Mono.<Void>fromRunnable(() -> consumer.accept(t))
					.subscribeOn(Schedulers.boundedElastic()));
			}

			List<Function<List<McpSchema.Resource>, Mono<Void>>> resourcesChangeConsumers = new ArrayList<>();
			for (Consumer<List<McpSchema.Resource>> consumer : syncSpec.resourcesChangeConsumers()) {
				resourcesChangeConsumers.add(r -> Mono.<Void>fromRunnable(() -> consumer.accept(r))
					.subscribeOn(Schedulers.boundedElastic()));
			}

			return new Async(syncSpec.options(), notificationHandlers, toolsChangeConsumers, resourcesChangeConsumers);
		}
	}

	/**
	 * 同步客户端的功能集合。
	 *
	 * @param options 客户端选项
	 * @param notificationHandlers 按方法名注册的通知消费者，接收原始参数
	 * @param toolsChangeConsumers 工具列表变化后接收最新列表的消费者
	 * @param resourcesChangeConsumers 资源列表变化后接收最新列表的消费者
	 */
	record Sync(McpClientOptions options, Map<String, Consumer<Object>> notificationHandlers,
			List<Consumer<List<McpSchema.Tool>>> toolsChangeConsumers,
			List<Consumer<List<McpSchema.Resource>>> resourcesChangeConsumers) {

		Sync(McpClientOptions options, Map<String, Consumer<Object>> notificationHandlers,
				List<Consumer<List<McpSchema.Tool>>> toolsChangeConsumers,
				List<Consumer<List<McpSchema.Resource>>> resourcesChangeConsumers) {
			this.options = (options != null) ? options : McpClientOptions.defaults();
			this.notificationHandlers = (notificationHandlers != null) ? Map.copyOf(notificationHandlers) : Map.of();
			this.toolsChangeConsumers = (toolsChangeConsumers != null) ? List.copyOf(toolsChangeConsumers) : List.of();
			this.resourcesChangeConsumers = (resourcesChangeConsumers != null) ? List.copyOf(resourcesChangeConsumers)
					: List.of();
		}
	}

}
