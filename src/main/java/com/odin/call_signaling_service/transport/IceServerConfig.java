package com.odin.call_signaling_service.transport;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class IceServerConfig {
    private List<String> urls = new ArrayList<>();
    private String username;
    private String credential;

    public static IceServerConfig of(String... urls) {
        return new IceServerConfig(new ArrayList<>(List.of(urls)), null, null);
    }
}
