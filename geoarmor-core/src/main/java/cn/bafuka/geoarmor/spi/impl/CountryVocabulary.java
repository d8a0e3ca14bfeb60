package cn.bafuka.geoarmor.spi.impl;

import cn.bafuka.geoarmor.spi.ValueVocabulary;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONObject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 国家名称词表
 * 从 classpath 下的 JSON 文件加载标准国家名和别名
 */
@Slf4j
public class CountryVocabulary implements ValueVocabulary {

    public static final String DEFAULT_RESOURCE = "geoarmor/countries.json";

    /**
     * 标准名称（保持文件中的顺序）
     */
    private final Set<String> countries;

    /**
     * 别名 -> 标准名称，别名已去除空白、点和横线并转大写
     */
    private final Map<String, String> aliases;

    /**
     * 小写名称 -> 标准名称
     */
    private final Map<String, String> lowerCaseIndex = new HashMap<>();

    public CountryVocabulary(Set<String> countries, Map<String, String> aliases) {
        this.countries = Collections.unmodifiableSet(new LinkedHashSet<>(countries));
        Map<String, String> normalizedAliases = new HashMap<>();
        aliases.forEach((alias, canonical) -> normalizedAliases.put(aliasKey(alias), canonical));
        this.aliases = Collections.unmodifiableMap(normalizedAliases);
        for (String country : this.countries) {
            lowerCaseIndex.put(country.toLowerCase(Locale.ROOT), country);
        }
    }

    /**
     * 从默认资源文件加载
     */
    public static CountryVocabulary loadDefault() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * 从指定 classpath 资源加载
     *
     * @param resource 资源路径
     * @return 词表
     */
    public static CountryVocabulary load(String resource) {
        ClassLoader classLoader = CountryVocabulary.class.getClassLoader();
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("词表资源不存在: " + resource);
            }
            String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            JSONObject json = JSON.parseObject(text);

            List<String> countries = json.getJSONArray("countries").toJavaList(String.class);
            Map<String, String> aliases = new HashMap<>();
            JSONObject aliasJson = json.getJSONObject("aliases");
            if (aliasJson != null) {
                aliasJson.forEach((alias, canonical) -> aliases.put(alias, String.valueOf(canonical)));
            }

            log.info("加载国家词表: resource={}, countries={}, aliases={}", resource, countries.size(), aliases.size());
            return new CountryVocabulary(new LinkedHashSet<>(countries), aliases);

        } catch (IOException e) {
            throw new UncheckedIOException("读取词表资源失败: " + resource, e);
        }
    }

    @Override
    public String canonicalize(String value) {
        if (value == null) {
            return null;
        }

        // 1. 精确匹配
        if (countries.contains(value)) {
            return value;
        }

        // 2. 别名匹配
        String canonical = aliases.get(aliasKey(value));
        if (canonical != null) {
            return countries.contains(canonical) ? canonical : null;
        }

        // 3. 忽略大小写匹配
        return lowerCaseIndex.get(value.trim().toLowerCase(Locale.ROOT));
    }

    public Set<String> getCountries() {
        return countries;
    }

    private static String aliasKey(String value) {
        return value.replaceAll("[\\s.\\-]", "").toUpperCase(Locale.ROOT);
    }
}
