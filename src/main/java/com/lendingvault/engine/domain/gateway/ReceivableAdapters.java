package com.lendingvault.engine.domain.gateway;

import com.lendingvault.engine.domain.exception.VaultErrorCode;
import com.lendingvault.engine.domain.exception.VaultException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public class ReceivableAdapters {

    private final Map<String, ReceivableAdapter> adapters = new LinkedHashMap<>();

    public ReceivableAdapters(Collection<? extends ReceivableAdapter> adapters) {
        for (ReceivableAdapter adapter : adapters) {
            this.adapters.put(adapter.platform(), adapter);
        }
    }

    public ReceivableAdapter forPlatform(String platform) {
        ReceivableAdapter adapter = adapters.get(platform);
        if (adapter == null) {
            throw new VaultException(VaultErrorCode.UNSUPPORTED_NOTE_TOKEN, "platform=" + platform);
        }
        return adapter;
    }

    public Set<String> platforms() {
        return adapters.keySet();
    }
}
