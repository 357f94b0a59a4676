package org.docmigrations.pipeline.source;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.docmigrations.pipeline.steps.MigrationStep;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Loads migration steps from a directory of jar files. Every {@code *.jar} in the directory is put
 * on a class loader whose providers are then discovered like {@link ServiceLoaderStepSource} does.
 * Providers on the parent class loader are found as well.
 *
 * Each load opens its own class loader; {@link #close()} closes all of them.
 */
@Slf4j
public class DirectoryStepSource implements StepSource {
    private final Path directory;
    private final ClassLoader parent;
    private final List<URLClassLoader> openLoaders = new CopyOnWriteArrayList<>();

    public DirectoryStepSource(Path directory) {
        this(directory, DirectoryStepSource.class.getClassLoader());
    }

    public DirectoryStepSource(Path directory, ClassLoader parent) {
        this.directory = directory;
        this.parent = parent;
    }

    @Override
    public Mono<List<MigrationStep>> loadSteps() {
        return Mono.fromCallable(this::createClassLoader)
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(loader -> new ServiceLoaderStepSource(loader).loadSteps());
    }

    @Override
    public void close() throws IOException {
        IOException failure = null;
        for (var loader : openLoaders) {
            openLoaders.remove(loader);
            try {
                loader.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    int openClassLoaderCount() {
        return openLoaders.size();
    }

    private ClassLoader createClassLoader() throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new NoSuchFileException(directory.toString(), null, "Migration steps directory not found");
        }
        List<Path> jars;
        try (Stream<Path> entries = Files.list(directory)) {
            jars = entries
                .filter(p -> p.getFileName().toString().endsWith(".jar"))
                .sorted()
                .collect(Collectors.toList());
        }
        log.info("Loading migration steps from {} jars in {}", jars.size(), directory);
        var urls = new ArrayList<URL>(jars.size());
        for (var jar : jars) {
            urls.add(toUrl(jar));
        }
        var loader = new URLClassLoader("migration-steps", urls.toArray(URL[]::new), parent);
        openLoaders.add(loader);
        return loader;
    }

    private static URL toUrl(Path jar) throws MalformedURLException {
        return jar.toUri().toURL();
    }
}
