package com.blogpulse.store;

import java.util.Map;

/**
 * 定长日志中的一条记录。
 *
 * @param id     存储生成的单调递增 ID（毫秒-序号）。
 * @param fields 记录字段。
 */
public record StreamEntry(String id, Map<String, String> fields) {
}
