package com.shlawgathon.faceguard.backend.websocket;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PongMessage implements RealtimeMessage {

    private String type = "pong";
}
