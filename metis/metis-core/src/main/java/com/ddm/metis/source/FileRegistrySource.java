package com.ddm.metis.source;

import com.ddm.metis.codec.DocumentLayout;
import com.ddm.metis.codec.EntityCodec;
import com.ddm.metis.codec.EntityCodecs;
import com.ddm.metis.defined.RegistryEntity;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * 本地结构化文件数据源（YAML / JSON）。
 *
 * <p><strong>读取规则：</strong>
 * <ul>
 *   <li>路径为文件时解析该文件；为目录时按文件名顺序解析其中全部 {@code .yaml}/{@code .yml}/{@code .json}</li>
 *   <li>文档按声明的 {@link DocumentLayout} 展开；单文件与布局不符时视为数据源不可用，
 *       目录中与布局不符的文件整体跳过并记录告警</li>
 *   <li>单条实体格式错误时记录告警并跳过</li>
 *   <li>路径不存在、或解码出的实体数少于 {@code minEntries} 时视为数据源不可用</li>
 * </ul>
 *
 * @author metis
 * @since 1.0
 */
public class FileRegistrySource<T extends RegistryEntity> implements RegistrySource<T> {

    private static final Logger log = LoggerFactory.getLogger(FileRegistrySource.class);

    private final Path path;
    private final DocumentLayout layout;
    private final EntityCodec<T> codec;
    private final int minEntries;

    public FileRegistrySource(Path path, DocumentLayout layout, EntityCodec<T> codec) {
        this(path, layout, codec, 0);
    }

    public FileRegistrySource(Path path, DocumentLayout layout, EntityCodec<T> codec, int minEntries) {
        this.path = path;
        this.layout = layout;
        this.codec = codec;
        this.minEntries = Math.max(0, minEntries);
    }

    @Override
    public String type() {
        return "file";
    }

    public Path path() {
        return path;
    }

    @Override
    public List<T> loadAll() {
        if (!Files.exists(path)) {
            throw new RegistrySourceException("Registry file not found: " + path);
        }
        List<T> entities = new ArrayList<>();
        if (Files.isDirectory(path)) {
            for (Path file : listFiles()) {
                try {
                    readFile(file, entities);
                } catch (IOException e) {
                    log.warn("Skipping unreadable registry file {}: {}", file, e.getMessage());
                } catch (IllegalArgumentException e) {
                    log.warn("Skipping registry file {}: {}", file, e.getMessage());
                }
            }
        } else {
            try {
                readFile(path, entities);
            } catch (IOException e) {
                throw new RegistrySourceException("Failed to read registry file: " + path, e);
            } catch (IllegalArgumentException e) {
                throw new RegistrySourceException("Registry file " + path + " does not match its layout: "
                        + e.getMessage(), e);
            }
        }
        if (entities.size() < minEntries) {
            throw new RegistrySourceException(String.format(
                    "Registry file %s yielded %d %s entries, expected at least %d",
                    path, entities.size(), codec.type().getSimpleName(), minEntries));
        }
        log.debug("Decoded {} {} entries from {}", entities.size(), codec.type().getSimpleName(), path);
        return entities;
    }

    private List<Path> listFiles() {
        try (Stream<Path> files = Files.list(path)) {
            return files.filter(Files::isRegularFile)
                    .filter(EntityCodecs::isRegistryFile)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new RegistrySourceException("Failed to list registry directory: " + path, e);
        }
    }

    private void readFile(Path file, List<T> out) throws IOException {
        JsonNode root = EntityCodecs.mapperFor(file).readTree(file.toFile());
        List<DocumentLayout.Entry> entries = layout.entries(root, documentName(file));
        for (DocumentLayout.Entry entry : entries) {
            try {
                out.add(layout.kind() == DocumentLayout.Kind.CONTRACT
                        ? codec.decodeDocument(entry.node(), entry.defaultId())
                        : codec.decode(entry.node(), entry.defaultId()));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping malformed entry in {}: {}", file, e.getMessage());
            }
        }
    }

    private static String documentName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
