package io.agentmail.directory;

import io.agentmail.error.CoordinationException;
import io.agentmail.model.Product;
import io.agentmail.model.Project;
import io.agentmail.storage.Database;
import io.agentmail.storage.DirectoryStore;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Products group projects for product-wide inbox and search.
 */
public final class ProductCatalog {
    private static final int MAX_NAME_LENGTH = 255;

    private final Database database;
    private final DirectoryStore directoryStore;

    public ProductCatalog(Database database, DirectoryStore directoryStore) {
        this.database = database;
        this.directoryStore = directoryStore;
    }

    public Product ensureProduct(String name, long nowMs) {
        if (name == null || name.isBlank()) {
            throw CoordinationException.validation("product name must not be blank");
        }
        String safeName = name.trim();
        if (safeName.length() > MAX_NAME_LENGTH) {
            throw CoordinationException.validation("product name longer than " + MAX_NAME_LENGTH + " characters");
        }
        return database.inTransaction("ensure product " + safeName, c -> {
            Optional<Product> existing = directoryStore.findProductByName(c, safeName);
            if (existing.isPresent()) {
                return existing.get();
            }
            String uid = UUID.randomUUID().toString().replace("-", "");
            return directoryStore.insertProduct(c, uid, safeName, nowMs);
        });
    }

    /**
     * @return true when the project was not linked before
     */
    public boolean linkProject(long productId, long projectId, long nowMs) {
        return database.inTransaction("link project to product", c -> {
            directoryStore.findProduct(c, productId).orElseThrow(() -> CoordinationException.notFound("Product", productId));
            directoryStore.findProject(c, projectId).orElseThrow(() -> CoordinationException.notFound("Project", projectId));
            return directoryStore.linkProductProject(c, productId, projectId, nowMs);
        });
    }

    public Optional<Product> findProduct(String name) {
        return database.read("find product", c -> directoryStore.findProductByName(c, name));
    }

    public List<Project> listProjects(long productId) {
        return database.read("list product projects", c -> {
            directoryStore.findProduct(c, productId).orElseThrow(() -> CoordinationException.notFound("Product", productId));
            return directoryStore.listProductProjects(c, productId);
        });
    }
}
