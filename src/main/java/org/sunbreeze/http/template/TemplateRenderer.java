package org.sunbreeze.http.template;

import java.util.Map;

public interface TemplateRenderer {

    byte[] render(String templateName, Map<String, ?> context);

}
