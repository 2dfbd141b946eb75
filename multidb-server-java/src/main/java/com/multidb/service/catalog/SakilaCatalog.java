package com.multidb.service.catalog;

import com.multidb.model.QueryTemplate;
import com.multidb.model.SearchType;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.multidb.model.QueryTemplate.when;

@Component
public class SakilaCatalog extends AbstractSourceCatalog {

    public static final String SOURCE = "sakila";

    private final List<QueryTemplate> queryTemplates = List.of(
        when(q -> hasAny(q, "film", "movie") && has(q, "actor"), """
            SELECT f.title, a.first_name, a.last_name
            FROM film f
            JOIN film_actor fa ON f.film_id = fa.film_id
            JOIN actor a ON fa.actor_id = a.actor_id
            ORDER BY f.title
            LIMIT 50
            """),
        when(q -> hasAny(q, "film", "movie"), """
            SELECT film_id, title, release_year, rating, length
            FROM film
            ORDER BY title
            LIMIT 50
            """),
        when(q -> has(q, "actor"), """
            SELECT actor_id, first_name, last_name
            FROM actor
            ORDER BY last_name, first_name
            LIMIT 50
            """),
        when(q -> has(q, "rental"), """
            SELECT r.rental_id, c.first_name, c.last_name,
                   f.title, r.rental_date, r.return_date
            FROM rental r
            JOIN customer c ON r.customer_id = c.customer_id
            JOIN inventory i ON r.inventory_id = i.inventory_id
            JOIN film f ON i.film_id = f.film_id
            ORDER BY r.rental_date DESC
            LIMIT 50
            """),
        when(q -> has(q, "customer"), """
            SELECT customer_id, first_name, last_name, email, active
            FROM customer
            ORDER BY last_name, first_name
            LIMIT 50
            """),
        when(q -> has(q, "category"), """
            SELECT category_id, name
            FROM category
            ORDER BY name
            LIMIT 50
            """)
    );

    private final List<QueryTemplate> crossSourceTemplates = List.of(
        when(q -> has(q, "customer") && has(q, "count"),
            "SELECT 'Movie Customers' as entity_type, COUNT(*) as count FROM customer"),
        when(q -> hasAny(q, "payment", "revenue"),
            "SELECT 'Movie Rentals' as source, SUM(amount) as total_revenue FROM payment"),
        when(q -> has(q, "email"),
            "SELECT DISTINCT email, 'Movie Customer' as type FROM customer WHERE email IS NOT NULL LIMIT 100"),
        when(q -> hasAny(q, "employee", "staff"),
            "SELECT staff_id as id, CONCAT(first_name, ' ', last_name) as name, 'Staff' as role FROM staff WHERE active = 1 LIMIT 100")
    );

    private final Map<String, String> entityCounts = new LinkedHashMap<>();

    public SakilaCatalog() {
        searchFragment(SearchType.NAME, """
            SELECT 'Actor' as type, CONCAT(first_name, ' ', last_name) as name,
                   NULL as email, actor_id as id
            FROM actor
            WHERE first_name LIKE ? OR last_name LIKE ?
            UNION ALL
            SELECT 'Customer' as type, CONCAT(first_name, ' ', last_name) as name,
                   email, customer_id as id
            FROM customer
            WHERE first_name LIKE ? OR last_name LIKE ?
            """);
        searchFragment(SearchType.EMAIL, """
            SELECT 'Customer' as type, CONCAT(first_name, ' ', last_name) as name,
                   email, customer_id as id
            FROM customer
            WHERE email LIKE ?
            """);
        searchFragment(SearchType.TITLE, """
            SELECT 'Film' as type, title as name, NULL as email, film_id as id
            FROM film
            WHERE title LIKE ?
            """);

        entityCounts.put("films", "SELECT COUNT(*) as c FROM film");
        entityCounts.put("actors", "SELECT COUNT(*) as c FROM actor");
        entityCounts.put("customers", "SELECT COUNT(*) as c FROM customer");
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
        return "SELECT 'Sakila Movie Rental Database. Ask about: films, actors, "
            + "customers, rentals, categories' as info";
    }

    @Override
    public List<QueryTemplate> crossSourceTemplates() {
        return crossSourceTemplates;
    }

    @Override
    public String crossSourceDefault() {
        return """
            SELECT 'Films' as entity, COUNT(*) as count FROM film
            UNION ALL
            SELECT 'Actors' as entity, COUNT(*) as count FROM actor
            UNION ALL
            SELECT 'Customers' as entity, COUNT(*) as count FROM customer
            """;
    }

    @Override
    public String customerCountStatement() {
        return "SELECT COUNT(*) as count FROM customer";
    }

    @Override
    public String paymentStatement() {
        return "SELECT COUNT(*) as count, SUM(amount) as total FROM payment";
    }

    @Override
    public Map<String, String> entityCountStatements() {
        return entityCounts;
    }
}
