package com.tessera.infrastructure.driver;

import com.tessera.domain.runner.adapter.driver.IFrameworkDriver;
import com.tessera.domain.runner.adapter.listener.ITestEventListener;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.StringWriter;
import java.util.Map;

/**
 * 无法执行测试的单元对应的驱动基类。
 * <p>
 * load / explore / run 返回描述该单元的 test-suite 片段，count 为 0，stop 不做任何事。
 * </p>
 *
 * @author getoffer
 * @since 2026-03-02
 */
public abstract class NotRunnableDriver implements IFrameworkDriver {

    private static final XMLOutputFactory OUTPUT_FACTORY = XMLOutputFactory.newFactory();

    private final String testFile;
    private final String name;
    private final String message;
    private final String runState;
    private final String result;
    private final String label;

    private String id;

    protected NotRunnableDriver(String testFile, String message, String runState, String result, String label) {
        this.testFile = testFile;
        this.name = fileName(testFile);
        this.message = message;
        this.runState = runState;
        this.result = result;
        this.label = label;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public void setId(String id) {
        this.id = id;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String load(String testFile, Map<String, Object> settings) {
        return suite(false);
    }

    @Override
    public String explore(String filter) {
        return suite(false);
    }

    @Override
    public int countTestCases(String filter) {
        return 0;
    }

    @Override
    public String run(ITestEventListener listener, String filter) {
        return suite(true);
    }

    @Override
    public void stopRun(boolean force) {
        // 没有可停止的执行
    }

    private String suite(boolean withResult) {
        StringWriter out = new StringWriter();
        try {
            XMLStreamWriter writer = OUTPUT_FACTORY.createXMLStreamWriter(out);
            writer.writeStartElement("test-suite");
            writer.writeAttribute("type", "Unit");
            writer.writeAttribute("id", String.valueOf(id) + "-1");
            writer.writeAttribute("name", String.valueOf(name));
            writer.writeAttribute("fullname", String.valueOf(testFile));
            writer.writeAttribute("runstate", runState);
            writer.writeAttribute("testcasecount", "0");
            if (withResult) {
                writer.writeAttribute("result", result);
                writer.writeAttribute("label", label);
                writer.writeAttribute("total", "0");
                writer.writeAttribute("passed", "0");
                writer.writeAttribute("failed", "0");
                writer.writeAttribute("skipped", "0");
            }
            writer.writeStartElement("properties");
            writer.writeEmptyElement("property");
            writer.writeAttribute("name", "_SKIPREASON");
            writer.writeAttribute("value", String.valueOf(message));
            writer.writeEndElement();
            if (withResult) {
                writer.writeStartElement("reason");
                writer.writeStartElement("message");
                writer.writeCharacters(String.valueOf(message));
                writer.writeEndElement();
                writer.writeEndElement();
            }
            writer.writeEndElement();
            writer.flush();
            writer.close();
        } catch (XMLStreamException ex) {
            throw new IllegalStateException("Failed to write result for " + testFile, ex);
        }
        return out.toString();
    }

    private static String fileName(String path) {
        if (path == null) {
            return null;
        }
        int separator = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return separator < 0 ? path : path.substring(separator + 1);
    }
}
