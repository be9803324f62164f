package com.study.webflux.memory.infrastructure.common.template;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

/**
 * classpath:templates/ 아래의 프롬프트 템플릿을 읽고 {{name}} 자리표시자를 치환합니다.
 */
@Component
public class FileBasedPromptTemplate {

	private static final List<String> TEMPLATE_EXTENSIONS = List.of(".md", ".txt");
	private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([a-zA-Z0-9_]+)}}");

	private final Map<String, String> cache = new ConcurrentHashMap<>();

	public String load(String templateName) {
		return cache.computeIfAbsent(templateName, this::readTemplate);
	}

	/**
	 * 템플릿을 읽어 변수를 치환합니다. 값이 주어지지 않은 자리표시자가 남아 있으면 예외를 던집니다.
	 */
	public String render(String templateName, Map<String, String> variables) {
		String template = load(templateName);
		Matcher matcher = PLACEHOLDER.matcher(template);
		StringBuilder result = new StringBuilder();
		while (matcher.find()) {
			String key = matcher.group(1);
			String value = variables.get(key);
			if (value == null) {
				throw new IllegalStateException(
					"Missing template variable '" + key + "' for template: " + templateName);
			}
			matcher.appendReplacement(result, Matcher.quoteReplacement(value));
		}
		matcher.appendTail(result);
		return result.toString();
	}

	private String readTemplate(String templateName) {
		ClassPathResource resource = resolveResource(templateName);
		try {
			return StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to load template: " + templateName, e);
		}
	}

	private ClassPathResource resolveResource(String templateName) {
		for (String ext : TEMPLATE_EXTENSIONS) {
			ClassPathResource resource = new ClassPathResource("templates/" + templateName + ext);
			if (resource.exists()) {
				return resource;
			}
		}
		throw new IllegalStateException("Template not found for name: " + templateName);
	}
}
