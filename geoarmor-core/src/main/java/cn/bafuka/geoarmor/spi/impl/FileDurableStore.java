package cn.bafuka.geoarmor.spi.impl;

import cn.bafuka.geoarmor.exception.GeoArmorException;
import cn.bafuka.geoarmor.spi.DurableStore;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONException;
import com.alibaba.fastjson.JSONObject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 基于本地 JSON 文件的持久化存储
 * 整个文件是一个 JSON 对象，写入时先写临时文件再原子替换
 */
@Slf4j
public class FileDurableStore implements DurableStore {

    /**
     * 存储文件
     */
    private final Path file;

    /**
     * 单线程 IO 执行器，保证读写串行
     */
    private final ExecutorService ioExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "geoarmor-file-store");
        thread.setDaemon(true);
        return thread;
    });

    public FileDurableStore(Path file) {
        this.file = file;
    }

    @Override
    public CompletableFuture<Map<String, String>> get(Collection<String> keys) {
        return CompletableFuture.supplyAsync(() -> {
            JSONObject all = readAll();
            Map<String, String> result = new HashMap<>();
            for (String key : keys) {
                String value = all.getString(key);
                if (value != null) {
                    result.put(key, value);
                }
            }
            return result;
        }, ioExecutor);
    }

    @Override
    public CompletableFuture<Void> set(Map<String, String> entries) {
        return CompletableFuture.runAsync(() -> {
            JSONObject all = readAll();
            all.putAll(entries);
            writeAll(all);
            log.debug("文件存储写入完成: file={}, keys={}", file, entries.keySet());
        }, ioExecutor);
    }

    @Override
    public String getType() {
        return "file";
    }

    /**
     * 关闭 IO 执行器（已提交的写入会执行完）
     */
    public void shutdown() {
        ioExecutor.shutdown();
    }

    private JSONObject readAll() {
        if (!Files.exists(file)) {
            return new JSONObject();
        }
        try {
            String text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            JSONObject parsed = text.trim().isEmpty() ? null : JSON.parseObject(text);
            return parsed != null ? parsed : new JSONObject();
        } catch (IOException | JSONException e) {
            throw new GeoArmorException("读取存储文件失败: " + file, e,
                    GeoArmorException.FailureReason.STORAGE_UNAVAILABLE);
        }
    }

    private void writeAll(JSONObject all) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.write(tmp, all.toJSONString().getBytes(StandardCharsets.UTF_8));
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new GeoArmorException("写入存储文件失败: " + file, e,
                    GeoArmorException.FailureReason.STORAGE_UNAVAILABLE);
        }
    }
}
