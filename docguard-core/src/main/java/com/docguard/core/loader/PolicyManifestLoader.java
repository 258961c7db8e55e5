package com.docguard.core.loader;

import com.docguard.api.config.PolicyManifest;
import com.docguard.api.exception.PolicyConfigurationException;
import com.docguard.core.policy.PolicyRegistry;
import com.docguard.core.util.YamlCompatUtils;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 策略清单加载器
 * <p>
 * 从文件、classpath 或输入流读取 YAML 清单，校验后编译为 {@link PolicyRegistry}。
 * 所有失败都在加载阶段以 {@link PolicyConfigurationException} 暴露。
 * </p>
 */
@Slf4j
public class PolicyManifestLoader {

    public static final String CLASSPATH_PREFIX = "classpath:";

    private PolicyManifestLoader() {
    }

    /**
     * 按位置加载：支持 "classpath:" 前缀，否则视为文件系统路径
     */
    public static PolicyRegistry loadRegistry(String location) {
        if (location == null || location.isBlank()) {
            throw new PolicyConfigurationException(location, "Manifest location cannot be blank");
        }
        if (location.startsWith(CLASSPATH_PREFIX)) {
            return loadRegistryFromClasspath(location.substring(CLASSPATH_PREFIX.length()));
        }
        return loadRegistry(Path.of(location));
    }

    public static PolicyRegistry loadRegistry(Path path) {
        String source = path.toString();
        if (!Files.isRegularFile(path)) {
            throw new PolicyConfigurationException(source, "Manifest file not found: " + source);
        }
        try (InputStream is = Files.newInputStream(path)) {
            return loadRegistry(is, source);
        } catch (IOException e) {
            throw new PolicyConfigurationException(source, "Failed to read manifest: " + source, e);
        }
    }

    public static PolicyRegistry loadRegistryFromClasspath(String resource) {
        String normalized = resource.startsWith("/") ? resource.substring(1) : resource;
        String source = CLASSPATH_PREFIX + normalized;
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) {
            cl = PolicyManifestLoader.class.getClassLoader();
        }
        InputStream stream = cl.getResourceAsStream(normalized);
        if (stream == null) {
            throw new PolicyConfigurationException(source, "Manifest resource not found: " + source);
        }
        try (InputStream is = stream) {
            return loadRegistry(is, source);
        } catch (IOException e) {
            throw new PolicyConfigurationException(source, "Failed to read manifest: " + source, e);
        }
    }

    public static PolicyRegistry loadRegistry(InputStream inputStream, String source) {
        PolicyManifest manifest = parseManifest(inputStream, source);
        PolicyRegistry registry = PolicyManifestCompiler.compile(manifest, source);
        log.info("[Manifest] Loaded '{}' from {} with collections {}", registry.getName(), source,
                registry.collectionNames());
        return registry;
    }

    /**
     * 仅解析与校验结构，不编译条件
     */
    public static PolicyManifest parseManifest(InputStream inputStream, String source) {
        Yaml yaml = YamlCompatUtils.createLoaderYaml(PolicyManifest.class);
        PolicyManifest manifest;
        try {
            manifest = yaml.load(inputStream);
        } catch (YAMLException e) {
            throw new PolicyConfigurationException(source, "Invalid manifest YAML: " + e.getMessage(), e);
        }
        if (manifest == null) {
            throw new PolicyConfigurationException(source, "Manifest is empty: " + source);
        }
        manifest.validate(source);
        return manifest;
    }
}
