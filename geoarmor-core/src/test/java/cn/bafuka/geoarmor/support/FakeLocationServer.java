package cn.bafuka.geoarmor.support;

import cn.bafuka.geoarmor.core.TransportResponse;
import cn.bafuka.geoarmor.spi.RemoteTransport;
import com.alibaba.fastjson.JSONObject;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 内存版共享位置服务，按 /check 和 /add 的约定应答
 */
public class FakeLocationServer implements RemoteTransport {

    private final Map<String, String> locations = new ConcurrentHashMap<>();

    private final AtomicInteger checkCount = new AtomicInteger();

    private final List<Map<String, Object>> added = new CopyOnWriteArrayList<>();

    @Override
    @SuppressWarnings("unchecked")
    public CompletableFuture<TransportResponse> call(String path, String method, Object body) {
        if ("GET".equals(method) && path.startsWith("/check?a=")) {
            checkCount.incrementAndGet();
            String username = URLDecoder.decode(path.substring("/check?a=".length()), StandardCharsets.UTF_8);
            String location = locations.get(username);
            if (location == null) {
                return CompletableFuture.completedFuture(TransportResponse.failure(404, "Not Found"));
            }
            JSONObject data = new JSONObject();
            data.put("username", username);
            data.put("location", location);
            data.put("cached", true);
            return CompletableFuture.completedFuture(new TransportResponse(true, 200, data, null));
        }

        if ("POST".equals(method) && "/add".equals(path)) {
            Map<String, Object> payload = (Map<String, Object>) body;
            added.add(payload);
            locations.put(String.valueOf(payload.get("username")), String.valueOf(payload.get("location")));
            return CompletableFuture.completedFuture(new TransportResponse(true, 201, new JSONObject(payload), null));
        }

        return CompletableFuture.completedFuture(TransportResponse.failure(404, "Not Found"));
    }

    public void put(String username, String location) {
        locations.put(username, location);
    }

    public String get(String username) {
        return locations.get(username);
    }

    public int getCheckCount() {
        return checkCount.get();
    }

    public List<Map<String, Object>> getAdded() {
        return added;
    }
}
