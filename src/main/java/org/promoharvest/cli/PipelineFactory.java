package org.promoharvest.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;
import org.promoharvest.pipeline.api.resources.IResource;
import org.promoharvest.pipeline.api.services.IService;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds resources and services from the {@code pipeline} configuration block.
 * <p>
 * Each resource under {@code pipeline.resources} and each service block names a {@code className}
 * plus {@code options}; classes are instantiated reflectively through their
 * {@code (String, Config)} or {@code (String, Config, Map<String, List<IResource>>)} constructor.
 * Resources are created on first use and shared between services.
 */
public class PipelineFactory {

    private final Config pipeline;
    private final Map<String, IResource> resources = new HashMap<>();

    public PipelineFactory(Config config) {
        if (!config.hasPath("pipeline")) {
            throw new IllegalArgumentException("Configuration has no 'pipeline' block");
        }
        this.pipeline = config.getConfig("pipeline");
    }

    public Config pipelineConfig() {
        return pipeline;
    }

    /**
     * Returns the named resource from {@code pipeline.resources}, creating it on first use.
     */
    public <T extends IResource> T resource(String name, Class<T> expectedType) {
        IResource resource = resources.computeIfAbsent(name, n -> {
            String path = "resources." + n;
            if (!pipeline.hasPath(path)) {
                throw new IllegalArgumentException("Resource '" + n + "' is not configured under pipeline.resources");
            }
            return create(n, IResource.class, pipeline.getConfig(path));
        });
        if (!expectedType.isInstance(resource)) {
            throw new IllegalArgumentException(String.format("Resource '%s' is a %s, expected %s",
                name, resource.getClass().getName(), expectedType.getName()));
        }
        return expectedType.cast(resource);
    }

    /**
     * Creates the service configured at {@code pipeline.<serviceKey>}, wiring its {@code resources}
     * ports ({@code port = "resourceName"} or a list of names).
     *
     * @param optionOverrides values layered over the service's options, e.g. from CLI flags
     */
    @SuppressWarnings("unchecked")
    public <T extends IService> T service(String serviceKey, Class<T> expectedType, Config optionOverrides) {
        if (!pipeline.hasPath(serviceKey)) {
            throw new IllegalArgumentException("Service '" + serviceKey + "' is not configured under pipeline");
        }
        Config serviceConfig = pipeline.getConfig(serviceKey);
        Config options = optionOverrides.withFallback(
            serviceConfig.hasPath("options") ? serviceConfig.getConfig("options") : ConfigFactory.empty());

        Map<String, List<IResource>> ports = new LinkedHashMap<>();
        if (serviceConfig.hasPath("resources")) {
            for (Map.Entry<String, ConfigValue> port : serviceConfig.getConfig("resources").root().entrySet()) {
                Object value = port.getValue().unwrapped();
                List<IResource> bound = new ArrayList<>();
                if (value instanceof List) {
                    for (Object name : (List<Object>) value) {
                        bound.add(resource(String.valueOf(name), IResource.class));
                    }
                } else {
                    bound.add(resource(String.valueOf(value), IResource.class));
                }
                ports.put(port.getKey(), bound);
            }
        }
        String className = requireClassName(serviceKey, serviceConfig);
        try {
            Class<?> serviceClass = Class.forName(className);
            if (!expectedType.isAssignableFrom(serviceClass)) {
                throw new IllegalArgumentException(String.format("Class %s is not a %s", className, expectedType.getName()));
            }
            Constructor<?> constructor = serviceClass.getConstructor(String.class, Config.class, Map.class);
            return (T) constructor.newInstance(serviceKey, options, ports);
        } catch (InvocationTargetException e) {
            throw rethrow("service", serviceKey, className, e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Failed to create service '" + serviceKey + "' with class " + className, e);
        }
    }

    /**
     * Instantiates one resource from a {@code className}/{@code options} block.
     */
    @SuppressWarnings("unchecked")
    public static <T extends IResource> T create(String name, Class<T> resourceInterface, Config config) {
        String className = requireClassName(name, config);
        Config options = config.hasPath("options") ? config.getConfig("options") : ConfigFactory.empty();
        try {
            Class<?> resourceClass = Class.forName(className);
            if (!resourceInterface.isAssignableFrom(resourceClass)) {
                throw new IllegalArgumentException(String.format("Class %s does not implement %s", className, resourceInterface.getName()));
            }
            Constructor<?> constructor = resourceClass.getConstructor(String.class, Config.class);
            return (T) constructor.newInstance(name, options);
        } catch (InvocationTargetException e) {
            throw rethrow("resource", name, className, e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Failed to create resource '" + name + "' with class " + className, e);
        }
    }

    private static String requireClassName(String name, Config config) {
        if (!config.hasPath("className")) {
            throw new IllegalArgumentException("Configuration of '" + name + "' is missing 'className'");
        }
        return config.getString("className");
    }

    private static RuntimeException rethrow(String kind, String name, String className, Throwable cause) {
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new IllegalStateException("Failed to create " + kind + " '" + name + "' with class " + className, cause);
    }
}
