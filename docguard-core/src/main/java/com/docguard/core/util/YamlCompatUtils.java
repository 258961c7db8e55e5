package com.docguard.core.util;

import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.lang.reflect.Method;
import java.lang.reflect.Proxy;

/**
 * YAML 兼容工具类
 * 处理 SnakeYAML 1.x 和 2.x 的差异，并对策略清单的解析做安全加固。
 */
@Slf4j
public class YamlCompatUtils {

    private static final String ALLOWED_TAG_PREFIX = "com.docguard.";

    // 清单体积很小，别名只会被用于攻击（billion laughs）
    private static final int MAX_ALIASES = 10;

    private YamlCompatUtils() {
    }

    /**
     * 创建绑定到指定根类型的 Yaml 实例
     * <p>
     * 禁止重复键，限制别名数量；SnakeYAML 2.x 下只放行 com.docguard.* 的全局标签。
     * </p>
     */
    public static Yaml createLoaderYaml(Class<?> rootType) {
        LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setAllowDuplicateKeys(false);
        loaderOptions.setMaxAliasesForCollections(MAX_ALIASES);
        configureTagInspector(loaderOptions);
        return new Yaml(new Constructor(rootType, loaderOptions));
    }

    private static void configureTagInspector(LoaderOptions loaderOptions) {
        try {
            // SnakeYAML 2.x: org.yaml.snakeyaml.inspector.TagInspector
            Class<?> tagInspectorClass = Class.forName("org.yaml.snakeyaml.inspector.TagInspector");

            Object inspector = Proxy.newProxyInstance(
                    YamlCompatUtils.class.getClassLoader(),
                    new Class<?>[] { tagInspectorClass },
                    (proxy, method, args) -> {
                        switch (method.getName()) {
                            case "hashCode":
                                return System.identityHashCode(proxy);
                            case "equals":
                                return proxy == args[0];
                            case "toString":
                                return "DocGuardTagInspector";
                            default:
                                break;
                        }
                        if ("isGlobalTagAllowed".equals(method.getName())) {
                            Object tag = args[0];
                            String className = (String) tag.getClass().getMethod("getClassName").invoke(tag);
                            return className != null && className.startsWith(ALLOWED_TAG_PREFIX);
                        }
                        return false;
                    });

            Method setter = LoaderOptions.class.getMethod("setTagInspector", tagInspectorClass);
            setter.invoke(loaderOptions, inspector);
        } catch (ClassNotFoundException e) {
            // SnakeYAML 1.x: 没有 TagInspector，根类型绑定已限制了可构造的类型
            log.debug("SnakeYAML 1.x detected, TagInspector not available");
        } catch (ReflectiveOperationException e) {
            log.warn("Failed to configure SnakeYAML TagInspector: {}", e.getMessage());
        }
    }
}
