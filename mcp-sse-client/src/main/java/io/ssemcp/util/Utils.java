/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.ssemcp.util;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.regex.Pattern;

import reactor.util.annotation.Nullable;

/**
 * 杂项工具方法，主要是事件流地址与消息提交地址之间的URI换算。
 *
 * @author Christian Tzolov
 */
public final class Utils {

	/** 连接地址末尾的 {@code /sse} 或 {@code /sse/} */
	private static final Pattern SSE_SUFFIX = Pattern.compile("/sse/?$");

	private Utils() {
	}

	/**
	 * 检查给定的{@code String}是否包含实际的<em>文本</em>。
	 * @param str 要检查的{@code String}（可能为{@code null}）
	 * @return 如果{@code String}不为{@code null}且不仅包含空白字符，则返回{@code true}
	 * @see Character#isWhitespace
	 */
	public static boolean hasText(@Nullable String str) {
		return (str != null && !str.isBlank());
	}

	/**
	 * 如果提供的Map为{@code null}或为空，则返回{@code true}。
	 * @param map 要检查的Map
	 * @return 给定的Map是否为空
	 */
	public static boolean isEmpty(@Nullable Map<?, ?> map) {
		return (map == null || map.isEmpty());
	}

	/**
	 * 去掉事件流连接地址末尾的 {@code /sse}（可带一个结尾斜杠），得到消息端点的基础地址。
	 * 地址带查询串时不做处理。
	 * @param streamUri 事件流连接地址
	 * @return 不带结尾 {@code /sse} 的地址字符串
	 */
	public static String baseOrigin(URI streamUri) {
		return SSE_SUFFIX.matcher(streamUri.toString()).replaceFirst("");
	}

	/**
	 * 判断值是否为 {@code http} 或 {@code https} 绝对地址。
	 * @param value 要检查的值
	 * @return 是绝对HTTP地址时返回{@code true}
	 */
	public static boolean isAbsoluteHttpUri(String value) {
		int colon = value.indexOf(':');
		if (colon <= 0) {
			return false;
		}
		String scheme = value.substring(0, colon);
		return (scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
				&& value.startsWith("//", colon + 1);
	}

	/**
	 * 读取查询参数的解码值。
	 * @param uri 目标地址
	 * @param name 参数名
	 * @return 参数值；不存在时为{@code null}，存在但无值时为空字符串
	 */
	@Nullable
	public static String queryParameter(URI uri, String name) {
		String query = uri.getRawQuery();
		if (query == null || query.isEmpty()) {
			return null;
		}
		for (String pair : query.split("&")) {
			int eq = pair.indexOf('=');
			String key = decode(eq < 0 ? pair : pair.substring(0, eq));
			if (key.equals(name)) {
				return eq < 0 ? "" : decode(pair.substring(eq + 1));
			}
		}
		return null;
	}

	/**
	 * 在地址上追加一个查询参数，保留已有的查询串和片段。
	 * @param uri 原地址
	 * @param name 参数名
	 * @param value 参数值
	 * @return 追加参数后的新地址
	 */
	public static URI withQueryParameter(URI uri, String name, String value) {
		String pair = encode(name) + "=" + encode(value);
		String query = uri.getRawQuery();
		String newQuery = (query == null || query.isEmpty()) ? pair : query + "&" + pair;

		StringBuilder sb = new StringBuilder();
		if (uri.getScheme() != null) {
			sb.append(uri.getScheme()).append(':');
		}
		if (uri.getRawAuthority() != null) {
			sb.append("//").append(uri.getRawAuthority());
		}
		if (uri.getRawPath() != null) {
			sb.append(uri.getRawPath());
		}
		sb.append('?').append(newQuery);
		if (uri.getRawFragment() != null) {
			sb.append('#').append(uri.getRawFragment());
		}
		return URI.create(sb.toString());
	}

	private static String decode(String value) {
		return URLDecoder.decode(value, StandardCharsets.UTF_8);
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8);
	}

}
