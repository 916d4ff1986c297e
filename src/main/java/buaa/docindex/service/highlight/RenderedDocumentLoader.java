package buaa.docindex.service.highlight;

import java.io.IOException;

/**
 * 从原始字节打开渲染文档
 */
@FunctionalInterface
public interface RenderedDocumentLoader {

    RenderedDocument load(byte[] documentBytes) throws IOException;
}
