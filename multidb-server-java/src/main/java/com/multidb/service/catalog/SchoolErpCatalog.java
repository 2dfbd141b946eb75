package com.multidb.service.catalog;

import com.multidb.model.QueryTemplate;
import com.multidb.model.SearchType;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.multidb.model.QueryTemplate.when;

@Component
public class SchoolErpCatalog extends AbstractSourceCatalog {

    public static final String SOURCE = "school_erp";

    private final List<QueryTemplate> queryTemplates = List.of(
        when(q -> has(q, "how many students") && hasAny(q, "class", "section"), """
            SELECT cs.class_number, cs.section,
                   COUNT(DISTINCT se.student_id) as student_count
            FROM sms_student_enrollments se
            JOIN sms_class_section cs ON se.class_section_id = cs.class_section_id
            WHERE se.status = 'active'
            GROUP BY cs.class_number, cs.section
            ORDER BY cs.class_number, cs.section
            LIMIT 50
            """),
        when(q -> has(q, "how many students"),
            "SELECT COUNT(*) as total_students FROM sms_students"),
        when(q -> hasAny(q, "list students", "show students"), """
            SELECT s.admission_no, s.name, s.gender, cs.class_number, cs.section, se.roll_no
            FROM sms_students s
            JOIN sms_student_enrollments se ON s.id = se.student_id
            JOIN sms_class_section cs ON se.class_section_id = cs.class_section_id
            WHERE se.status = 'active'
            ORDER BY cs.class_number, cs.section, se.roll_no
            LIMIT 50
            """),
        when(q -> has(q, "teacher"), """
            SELECT staff_id, CONCAT(first_name, ' ', last_name) as name,
                   role, department, phone, email
            FROM sms_teachers
            WHERE status = 'active'
            ORDER BY first_name
            LIMIT 50
            """),
        when(q -> has(q, "fee") && hasAny(q, "pending", "unpaid"), """
            SELECT s.admission_no, s.name, cs.class_number, cs.section,
                   fs.month, fs.total_amount
            FROM sms_students s
            JOIN sms_student_enrollments se ON s.id = se.student_id
            JOIN sms_class_section cs ON se.class_section_id = cs.class_section_id
            JOIN fee_structures fs ON cs.class_section_id = fs.class_section_id
            LEFT JOIN fee_payments fp ON s.id = fp.student_id AND fs.month = fp.month
            WHERE fp.id IS NULL AND se.status = 'active'
            LIMIT 50
            """),
        when(q -> hasAny(q, "library", "book"), """
            SELECT book_id, title, author, publisher, copies, location
            FROM library_books
            ORDER BY title
            LIMIT 50
            """)
    );

    private final List<QueryTemplate> crossSourceTemplates = List.of(
        when(q -> has(q, "customer") && has(q, "count"),
            "SELECT 'School Students' as entity_type, COUNT(*) as count FROM sms_students"),
        when(q -> hasAny(q, "payment", "revenue"),
            "SELECT 'School Fees' as source, SUM(amount_paid) as total_revenue FROM fee_payments"),
        when(q -> has(q, "email"),
            "SELECT DISTINCT email, 'Student' as type FROM sms_students WHERE email IS NOT NULL LIMIT 100"),
        when(q -> hasAny(q, "employee", "staff"),
            "SELECT staff_id as id, CONCAT(first_name, ' ', last_name) as name, role FROM sms_teachers WHERE status = 'active' LIMIT 100")
    );

    private final Map<String, String> entityCounts = new LinkedHashMap<>();

    public SchoolErpCatalog() {
        searchFragment(SearchType.NAME, """
            SELECT 'Student' as type, name, email, admission_no as id
            FROM sms_students
            WHERE name LIKE ?
            UNION ALL
            SELECT 'Teacher' as type, CONCAT(first_name, ' ', last_name) as name,
                   email, staff_id as id
            FROM sms_teachers
            WHERE first_name LIKE ? OR last_name LIKE ?
            """);
        searchFragment(SearchType.EMAIL, """
            SELECT 'Student' as type, name, email, admission_no as id
            FROM sms_students
            WHERE email LIKE ?
            UNION ALL
            SELECT 'Teacher' as type, CONCAT(first_name, ' ', last_name) as name,
                   email, staff_id as id
            FROM sms_teachers
            WHERE email LIKE ?
            """);
        searchFragment(SearchType.TITLE, """
            SELECT 'Book' as type, title as name, NULL as email, book_id as id
            FROM library_books
            WHERE title LIKE ?
            """);

        entityCounts.put("students", "SELECT COUNT(*) as c FROM sms_students");
        entityCounts.put("teachers", "SELECT COUNT(*) as c FROM sms_teachers");
        entityCounts.put("classes", "SELECT COUNT(*) as c FROM sms_class_section");
    }

    @Override
    public String sourceName() {
        return SOURCE;
    }

    @Override
    public List<QueryTemplate> queryTemplates() {
        return queryTemplates;
    }

    @Override
    public String helpStatement() {
        return "SELECT 'school_erp School Database. Ask about: students, teachers, classes, "
            + "fees, attendance, marks, library' as info";
    }

    @Override
    public List<QueryTemplate> crossSourceTemplates() {
        return crossSourceTemplates;
    }

    @Override
    public String crossSourceDefault() {
        return """
            SELECT 'Students' as entity, COUNT(*) as count FROM sms_students
            UNION ALL
            SELECT 'Teachers' as entity, COUNT(*) as count FROM sms_teachers
            """;
    }

    @Override
    public String customerCountStatement() {
        return "SELECT COUNT(*) as count FROM sms_students";
    }

    @Override
    public String paymentStatement() {
        return "SELECT COUNT(*) as count, SUM(amount_paid) as total FROM fee_payments";
    }

    @Override
    public Map<String, String> entityCountStatements() {
        return entityCounts;
    }
}
