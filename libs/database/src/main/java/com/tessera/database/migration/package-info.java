/** Flyway migrations for the item and snapshot tables. */
package com.tessera.database.migration;
