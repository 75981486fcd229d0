package com.tessera.infrastructure.codec;

import com.tessera.domain.pkg.adapter.codec.IPackageCodec;
import com.tessera.domain.pkg.model.entity.TestPackageEntity;
import com.tessera.types.exception.PackageFormatException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import javax.xml.stream.XMLStreamWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;

/**
 * 测试包 XML 编解码实现。
 * <p>
 * 格式：
 * <pre>
 * &lt;TestPackage id="0" fullname="/abs/a.jar"&gt;
 *   &lt;Settings key="value"/&gt;
 *   &lt;TestPackage id="1"&gt;...&lt;/TestPackage&gt;
 * &lt;/TestPackage&gt;
 * </pre>
 * 解析时每个包只读取自己的 Settings，不经过 addSetting 向下传播。
 * </p>
 *
 * @author getoffer
 * @since 2026-03-02
 */
@Component
public class TestPackageXmlCodec implements IPackageCodec {

    static final String PACKAGE_ELEMENT = "TestPackage";
    static final String SETTINGS_ELEMENT = "Settings";
    static final String ID_ATTRIBUTE = "id";
    static final String FULL_NAME_ATTRIBUTE = "fullname";

    private final XMLInputFactory inputFactory;
    private final XMLOutputFactory outputFactory;

    public TestPackageXmlCodec() {
        this.inputFactory = XMLInputFactory.newFactory();
        this.inputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        this.inputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        this.inputFactory.setProperty(XMLInputFactory.IS_COALESCING, true);
        this.outputFactory = XMLOutputFactory.newFactory();
    }

    @Override
    public String write(TestPackageEntity testPackage) {
        if (testPackage == null) {
            throw new IllegalArgumentException("TestPackage cannot be null");
        }
        StringWriter out = new StringWriter();
        XMLStreamWriter writer = null;
        try {
            writer = outputFactory.createXMLStreamWriter(out);
            writer.writeStartElement(PACKAGE_ELEMENT);
            writePackage(writer, testPackage);
            writer.writeEndElement();
            writer.flush();
        } catch (XMLStreamException ex) {
            throw new IllegalStateException("Failed to write test package: " + testPackage.getId(), ex);
        } finally {
            close(writer);
        }
        return out.toString();
    }

    private void writePackage(XMLStreamWriter writer, TestPackageEntity testPackage) throws XMLStreamException {
        if (testPackage.getId() == null) {
            throw new IllegalArgumentException("TestPackage id cannot be null");
        }
        writer.writeAttribute(ID_ATTRIBUTE, checkValue(ID_ATTRIBUTE, testPackage.getId()));
        if (testPackage.getFullName() != null) {
            writer.writeAttribute(FULL_NAME_ATTRIBUTE, checkValue(FULL_NAME_ATTRIBUTE, testPackage.getFullName()));
        }

        if (!testPackage.getSettings().isEmpty()) {
            writer.writeEmptyElement(SETTINGS_ELEMENT);
            for (Map.Entry<String, Object> setting : testPackage.getSettings().entrySet()) {
                String name = checkName(setting.getKey());
                writer.writeAttribute(name, checkValue(name, String.valueOf(setting.getValue())));
            }
        }

        for (TestPackageEntity subPackage : testPackage.getSubPackages()) {
            writer.writeStartElement(PACKAGE_ELEMENT);
            writePackage(writer, subPackage);
            writer.writeEndElement();
        }
    }

    /**
     * 设置名直接作为属性名写出，必须是合法的 XML 名称（不含命名空间前缀）。
     */
    private String checkName(String name) {
        if (StringUtils.isEmpty(name) || !isNameStart(name.codePointAt(0))) {
            throw new PackageFormatException("Setting name is not a valid XML attribute name: '" + name + "'");
        }
        int i = Character.charCount(name.codePointAt(0));
        while (i < name.length()) {
            int c = name.codePointAt(i);
            if (!isNameChar(c)) {
                throw new PackageFormatException("Setting name is not a valid XML attribute name: '" + name + "'");
            }
            i += Character.charCount(c);
        }
        return name;
    }

    /**
     * 属性值中的制表符和换行在读取时会被规范化为空格，XML 1.0 之外的字符无法表示，两者都在写出时拒绝。
     */
    private String checkValue(String name, String value) {
        int i = 0;
        while (i < value.length()) {
            int c = value.codePointAt(i);
            if (c < 0x20 || (c >= 0xD800 && c <= 0xDFFF) || c == 0xFFFE || c == 0xFFFF) {
                throw new PackageFormatException(String.format(
                        "Value of '%s' contains a character that cannot be written to XML: U+%04X", name, c));
            }
            i += Character.charCount(c);
        }
        return value;
    }

    private static boolean isNameStart(int c) {
        return c == '_' || (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z')
                || (c >= 0xC0 && c <= 0xD6) || (c >= 0xD8 && c <= 0xF6) || (c >= 0xF8 && c <= 0x2FF)
                || (c >= 0x370 && c <= 0x37D) || (c >= 0x37F && c <= 0x1FFF) || (c >= 0x200C && c <= 0x200D)
                || (c >= 0x2070 && c <= 0x218F) || (c >= 0x2C00 && c <= 0x2FEF) || (c >= 0x3001 && c <= 0xD7FF)
                || (c >= 0xF900 && c <= 0xFDCF) || (c >= 0xFDF0 && c <= 0xFFFD) || (c >= 0x10000 && c <= 0xEFFFF);
    }

    private static boolean isNameChar(int c) {
        return isNameStart(c) || c == '-' || c == '.' || (c >= '0' && c <= '9') || c == 0xB7
                || (c >= 0x300 && c <= 0x36F) || (c >= 0x203F && c <= 0x2040);
    }

    @Override
    public TestPackageEntity read(String text) {
        if (StringUtils.isBlank(text)) {
            throw new PackageFormatException("Invalid XML: document is empty.");
        }
        XMLStreamReader reader = null;
        try {
            reader = inputFactory.createXMLStreamReader(new StringReader(text));
            return readDocument(reader);
        } catch (XMLStreamException ex) {
            throw new PackageFormatException("Invalid XML: " + ex.getMessage(), ex);
        } finally {
            close(reader);
        }
    }

    private TestPackageEntity readDocument(XMLStreamReader reader) throws XMLStreamException {
        Deque<TestPackageEntity> open = new ArrayDeque<>();
        TestPackageEntity root = null;

        while (reader.hasNext()) {
            int event = reader.next();
            switch (event) {
                case XMLStreamConstants.START_ELEMENT:
                    String name = reader.getLocalName();
                    if (PACKAGE_ELEMENT.equals(name)) {
                        TestPackageEntity testPackage = readIdentity(reader);
                        if (open.isEmpty()) {
                            root = testPackage;
                        } else {
                            open.peek().getSubPackages().add(testPackage);
                        }
                        open.push(testPackage);
                    } else if (SETTINGS_ELEMENT.equals(name) && !open.isEmpty()) {
                        readSettings(reader, open.peek());
                    } else {
                        throw new PackageFormatException("Unexpected element: " + name);
                    }
                    break;

                case XMLStreamConstants.END_ELEMENT:
                    open.pop();
                    if (open.isEmpty()) {
                        return root;
                    }
                    break;

                case XMLStreamConstants.CHARACTERS:
                case XMLStreamConstants.SPACE:
                    if (!reader.isWhiteSpace()) {
                        throw new PackageFormatException("Unexpected text: " + StringUtils.abbreviate(reader.getText().trim(), 40));
                    }
                    break;

                case XMLStreamConstants.COMMENT:
                    break;

                case XMLStreamConstants.END_DOCUMENT:
                    break;

                default:
                    throw new PackageFormatException("Unexpected node type: " + event);
            }
        }

        throw new PackageFormatException("Invalid XML: TestPackage element not terminated.");
    }

    private TestPackageEntity readIdentity(XMLStreamReader reader) {
        String id = reader.getAttributeValue(null, ID_ATTRIBUTE);
        if (id == null) {
            throw new PackageFormatException("TestPackage element is missing the id attribute.");
        }
        String fullName = reader.getAttributeValue(null, FULL_NAME_ATTRIBUTE);
        return new TestPackageEntity(id, fullName);
    }

    private void readSettings(XMLStreamReader reader, TestPackageEntity testPackage) throws XMLStreamException {
        for (int i = 0; i < reader.getAttributeCount(); i++) {
            testPackage.getSettings().put(reader.getAttributeLocalName(i), reader.getAttributeValue(i));
        }
        // Settings 只允许属性，不允许子内容
        reader.nextTag();
        if (reader.getEventType() != XMLStreamConstants.END_ELEMENT) {
            throw new PackageFormatException("Settings element must be empty.");
        }
    }

    private void close(XMLStreamReader reader) {
        if (reader == null) {
            return;
        }
        try {
            reader.close();
        } catch (XMLStreamException ex) {
            throw new IllegalStateException("Failed to close xml reader", ex);
        }
    }

    private void close(XMLStreamWriter writer) {
        if (writer == null) {
            return;
        }
        try {
            writer.close();
        } catch (XMLStreamException ex) {
            throw new IllegalStateException("Failed to close xml writer", ex);
        }
    }
}
