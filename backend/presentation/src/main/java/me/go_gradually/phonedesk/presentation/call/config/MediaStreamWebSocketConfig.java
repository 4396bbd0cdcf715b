package me.go_gradually.phonedesk.presentation.call.config;

import me.go_gradually.phonedesk.presentation.call.websocket.MediaStreamWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
public class MediaStreamWebSocketConfig implements WebSocketConfigurer {
    public static final String MEDIA_STREAM_PATH = "/twilio-media-stream";

    private final MediaStreamWebSocketHandler mediaStreamWebSocketHandler;

    public MediaStreamWebSocketConfig(MediaStreamWebSocketHandler mediaStreamWebSocketHandler) {
        this.mediaStreamWebSocketHandler = mediaStreamWebSocketHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(mediaStreamWebSocketHandler, MEDIA_STREAM_PATH)
                .setAllowedOriginPatterns("*");
    }

    @Bean
    public ServletServerContainerFactoryBean webSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(262_144);
        container.setMaxBinaryMessageBufferSize(262_144);
        return container;
    }
}
