package com.graphoid.script.runtime;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.graphoid.debug.Debug;
import com.graphoid.script.errors.GraphoidException;
import com.graphoid.script.errors.SourcePosition;

/**
 * Module bookkeeping shared by every interpreter of one engine: the resolved-path cache (each file is
 * evaluated at most once), the in-progress set guarding against circular imports, and native modules
 * registered by the host.
 */
public final class ModuleManager {
    private static final String TAG = "Modules";
    public static final String EXTENSION = ".gr";

    private final Map<String, ModuleValue> cache = new LinkedHashMap<>();
    private final Set<Path> loading = new LinkedHashSet<>();
    private final List<Path> importStack = new ArrayList<>();
    private final Map<String, ModuleValue> nativeModules = new LinkedHashMap<>();
    private final List<Path> searchPaths = new ArrayList<>();
    private ModuleResolver resolver = this::resolveOnDisk;

    public void setResolver(ModuleResolver resolver) {
        this.resolver = (resolver == null) ? this::resolveOnDisk : resolver;
    }

    public void addSearchPath(Path dir) {
        searchPaths.add(dir);
    }

    public List<Path> getSearchPaths() {
        return Collections.unmodifiableList(searchPaths);
    }

    public void registerNative(String name, Map<String, Value> members) {
        nativeModules.put(name, new ModuleValue(name, null, null, members, Collections.emptySet()));
    }

    public ModuleValue nativeModule(String name) {
        return nativeModules.get(name);
    }

    /** Resolves {@code spec} or fails with ModuleNotFound. */
    public Path resolve(String spec, Path currentFile, SourcePosition pos) {
        Path p = resolver.resolve(spec, currentFile);
        if (p == null) throw GraphoidException.moduleNotFound(spec, pos);
        Debug.get().d(TAG, "resolved '" + spec + "' -> " + p);
        return p;
    }

    /** Default resolution: {@code spec}, then {@code spec.gr}, next to the importing file, then in each search path. */
    private Path resolveOnDisk(String spec, Path currentFile) {
        List<Path> bases = new ArrayList<>();
        if (currentFile != null && currentFile.getParent() != null) bases.add(currentFile.getParent());
        else bases.add(Path.of("").toAbsolutePath());
        bases.addAll(searchPaths);
        for (Path base : bases) {
            Path candidate = base.resolve(spec);
            if (Files.isRegularFile(candidate)) return candidate.toAbsolutePath().normalize();
            Path withExt = base.resolve(spec + EXTENSION);
            if (!spec.endsWith(EXTENSION) && Files.isRegularFile(withExt)) return withExt.toAbsolutePath().normalize();
        }
        return null;
    }

    public ModuleValue cached(Path path) {
        ModuleValue m = cache.get(key(path));
        if (m != null) Debug.get().d(TAG, "cache hit " + path);
        return m;
    }

    /** Marks {@code path} as loading; an import of a file already loading is a circular dependency. */
    public void beginLoading(Path path, SourcePosition pos) {
        if (loading.contains(path)) {
            List<String> chain = new ArrayList<>();
            boolean inCycle = false;
            for (Path p : importStack) {
                if (p.equals(path)) inCycle = true;
                if (inCycle) chain.add(p.getFileName().toString());
            }
            chain.add(path.getFileName().toString());
            throw GraphoidException.circularDependency(chain, pos);
        }
        loading.add(path);
        importStack.add(path);
        Debug.get().d(TAG, "loading " + path);
    }

    public void endLoading(Path path) {
        loading.remove(path);
        importStack.remove(importStack.size() - 1);
    }

    public void register(Path path, ModuleValue module) {
        cache.put(key(path), module);
    }

    public boolean isLoaded(Path path) {
        return cache.containsKey(key(path));
    }

    public static String readSource(Path path, SourcePosition pos) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw GraphoidException.io("Cannot read " + path + ": " + e.getMessage(), pos);
        }
    }

    /** File name without the {@code .gr} extension. */
    public static String stem(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return (dot > 0) ? name.substring(0, dot) : name;
    }

    private static String key(Path path) {
        return path.toAbsolutePath().normalize().toString();
    }
}
