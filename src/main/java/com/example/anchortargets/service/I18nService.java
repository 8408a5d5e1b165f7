package com.example.anchortargets.service;

import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

@Service
public class I18nService {

    private final Map<String, Map<String, String>> messages = new HashMap<>();

    public I18nService() {
        initializeMessages();
    }

    private void initializeMessages() {
        // Chinese (Simplified) Messages
        Map<String, String> zhMessages = new HashMap<>();
        zhMessages.put("database.built", "锚框数据库构建成功");
        zhMessages.put("sample.drawn", "锚框采样成功");
        zhMessages.put("sample.short", "可用锚框不足，采样数量少于请求数量");
        zhMessages.put("targets.assembled", "训练目标生成成功");
        zhMessages.put("epoch.planned", "训练顺序生成成功");
        zhMessages.put("image.not_found", "图像记录不存在");
        zhMessages.put("database.empty", "锚框数据库为空");
        zhMessages.put("bad.request", "请求参数错误");
        zhMessages.put("server.error", "服务器内部错误");

        // English Messages
        Map<String, String> enMessages = new HashMap<>();
        enMessages.put("database.built", "Anchor database built");
        enMessages.put("sample.drawn", "Anchor sample drawn");
        enMessages.put("sample.short", "Not enough labeled anchors; sample is shorter than requested");
        enMessages.put("targets.assembled", "Training targets assembled");
        enMessages.put("epoch.planned", "Epoch order planned");
        enMessages.put("image.not_found", "Image record not found");
        enMessages.put("database.empty", "Anchor database is empty");
        enMessages.put("bad.request", "Invalid request");
        enMessages.put("server.error", "Internal server error");

        messages.put("zh", zhMessages);
        messages.put("en", enMessages);
    }

    /**
     * Message for a key in the given language, falling back to English and then to the key itself
     */
    public String getMessage(String key, String language) {
        Map<String, String> languageMessages = messages.getOrDefault(normalize(language), messages.get("en"));
        String message = languageMessages.get(key);
        if (message == null) {
            message = messages.get("en").getOrDefault(key, key);
        }
        return message;
    }

    /**
     * Language code from an Accept-Language header value, English unless it asks for Chinese
     */
    public String resolveLanguage(String acceptLanguage) {
        if (acceptLanguage != null && acceptLanguage.toLowerCase().startsWith("zh")) {
            return "zh";
        }
        return "en";
    }

    private String normalize(String language) {
        if (language == null) {
            return "en";
        }
        return language.toLowerCase().startsWith("zh") ? "zh" : "en";
    }
}
