package com.tessera.domain.pkg.model.entity;

import com.tessera.domain.pkg.model.valobj.UnitFileTypes;
import com.tessera.types.exception.SettingTypeMismatchException;
import lombok.Getter;
import org.apache.commons.lang3.ClassUtils;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 测试包领域实体
 * <p>
 * 测试包描述一组待加载的测试文件。叶子包（无子包且带 fullName）对应唯一一个可加载单元，
 * 结构包只负责分组。构造时分配的 ID 在实例生命周期内不变，驱动用它给测试 ID 加前缀。
 * </p>
 * <p>
 * 需要重新加载并保持测试 ID 稳定的调用方应复用原包实例、按需修改设置，而不是新建包。
 * </p>
 *
 * @author getoffer
 * @since 2026-03-02
 */
@Getter
public class TestPackageEntity {

    /**
     * 包 ID，构造后不可变
     */
    private final String id;

    /**
     * 测试单元的绝对路径，匿名（分组）包为 null
     */
    private final String fullName;

    /**
     * 子包，插入顺序即加载与结果汇总顺序
     */
    private final List<TestPackageEntity> subPackages = new ArrayList<>();

    /**
     * 本包的设置；直接修改不会传播到子包
     */
    private final Map<String, Object> settings = new LinkedHashMap<>();

    public TestPackageEntity(String id, String fullName) {
        this.id = id;
        this.fullName = fullName;
    }

    /**
     * 包名：fullName 最后一个分隔符之后的部分，以分隔符结尾时为空串，匿名包为 null
     */
    public String getName() {
        if (fullName == null) {
            return null;
        }
        int separator = Math.max(fullName.lastIndexOf('/'), fullName.lastIndexOf('\\'));
        return fullName.substring(separator + 1);
    }

    public boolean hasSubPackages() {
        return !subPackages.isEmpty();
    }

    /**
     * 是否叶子包：没有子包且带 fullName
     */
    public boolean isLeaf() {
        return !hasSubPackages() && fullName != null;
    }

    /**
     * 是否单元包：fullName 指向可加载单元文件
     */
    public boolean isUnitPackage(UnitFileTypes unitFileTypes) {
        return fullName != null && unitFileTypes != null && unitFileTypes.isUnitFile(fullName);
    }

    /**
     * 添加子包，并把当前设置复制给子包。
     * <p>
     * 只复制调用时刻已有的设置；之后直接写入 settings 的值不会同步到子包。
     * </p>
     *
     * @param subPackage 子包
     */
    public void addSubPackage(TestPackageEntity subPackage) {
        if (subPackage == null) {
            throw new IllegalArgumentException("SubPackage cannot be null");
        }
        subPackages.add(subPackage);
        subPackage.settings.putAll(settings);
    }

    /**
     * 设置本包及所有后代包的同名设置，已有值会被覆盖。
     *
     * @param name 设置名
     * @param value 设置值
     */
    public void addSetting(String name, Object value) {
        if (StringUtils.isBlank(name)) {
            throw new IllegalArgumentException("Setting name cannot be blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("Setting value cannot be null: " + name);
        }
        for (TestPackageEntity node : traverse()) {
            node.settings.put(name, value);
        }
    }

    /**
     * 读取设置，不存在时返回默认值。
     * <p>
     * 字符串值按请求类型解析为 Boolean / Integer / Long（解码后的设置均为字符串）；
     * 其余类型不兼容时抛出 {@link SettingTypeMismatchException}。
     * </p>
     */
    public <T> T getSetting(String name, Class<T> type, T defaultValue) {
        Object value = settings.get(name);
        if (value == null) {
            return defaultValue;
        }
        @SuppressWarnings("unchecked")
        Class<T> boxed = (Class<T>) ClassUtils.primitiveToWrapper(type);
        if (boxed.isInstance(value)) {
            return boxed.cast(value);
        }
        if (value instanceof String) {
            return boxed.cast(parse(name, (String) value, boxed));
        }
        throw new SettingTypeMismatchException(name, type, value.getClass());
    }

    public String getSetting(String name, String defaultValue) {
        return getSetting(name, String.class, defaultValue);
    }

    public boolean getSetting(String name, boolean defaultValue) {
        return getSetting(name, Boolean.class, defaultValue);
    }

    public int getSetting(String name, int defaultValue) {
        return getSetting(name, Integer.class, defaultValue);
    }

    /**
     * 按先序深度优先顺序选出匹配的包（含自身）。
     *
     * @param selector 选择条件
     * @return 匹配的包，顺序与树的先序遍历一致
     */
    public List<TestPackageEntity> select(Predicate<TestPackageEntity> selector) {
        List<TestPackageEntity> selection = new ArrayList<>();
        for (TestPackageEntity node : traverse()) {
            if (selector.test(node)) {
                selection.add(node);
            }
        }
        return selection;
    }

    // 先序遍历，按实例身份去重，共享节点只访问一次
    private List<TestPackageEntity> traverse() {
        List<TestPackageEntity> ordered = new ArrayList<>();
        Set<TestPackageEntity> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<TestPackageEntity> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            TestPackageEntity node = stack.pop();
            if (!visited.add(node)) {
                continue;
            }
            ordered.add(node);
            List<TestPackageEntity> children = node.subPackages;
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return ordered;
    }

    private Object parse(String name, String text, Class<?> type) {
        if (type == String.class) {
            return text;
        }
        String trimmed = text.trim();
        if (type == Boolean.class) {
            if ("true".equalsIgnoreCase(trimmed)) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(trimmed)) {
                return Boolean.FALSE;
            }
            throw new SettingTypeMismatchException(name, type, String.class);
        }
        try {
            if (type == Integer.class) {
                return Integer.valueOf(trimmed);
            }
            if (type == Long.class) {
                return Long.valueOf(trimmed);
            }
        } catch (NumberFormatException ex) {
            throw new SettingTypeMismatchException(name, type, String.class, ex);
        }
        throw new SettingTypeMismatchException(name, type, String.class);
    }

    @Override
    public String toString() {
        return "TestPackageEntity{" +
                "id='" + id + '\'' +
                ", fullName='" + fullName + '\'' +
                ", subPackages=" + subPackages.size() +
                '}';
    }
}
