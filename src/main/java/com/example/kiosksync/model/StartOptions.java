package com.example.kiosksync.model;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StartOptions {
    private String userId;
    private String userName;
    private boolean kioskMode;
    private String location;

    public static StartOptions kiosk(String location) {
        return StartOptions.builder().kioskMode(true).location(location).build();
    }
}
