package com.myorg.ebus.discovery;

import java.util.List;

public interface ServiceLocator {

    /**
     * Instances registered under {@code serviceName} (case-insensitive).
     *
     * @param tagFilter comma separated tags; an instance matches when it carries any of them.
     *                  Blank matches every instance.
     */
    List<ServiceEndpoint> find(String serviceName, String tagFilter);
}
